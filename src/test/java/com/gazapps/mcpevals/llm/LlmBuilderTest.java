package com.gazapps.mcpevals.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import com.gazapps.mcpevals.config.Config;
import com.gazapps.mcpevals.llm.providers.AzureOpenAi;
import com.gazapps.mcpevals.llm.providers.Claude;
import com.gazapps.mcpevals.llm.providers.OpenAi;
import com.gazapps.mcpevals.model.ModelConfiguration;

class LlmBuilderTest {

    private final Config config = new Config(new Properties());

    @Test
    void explicitKey_buildsProviderForModel() {
        LanguageModel model = LlmBuilder.from(new ModelConfiguration("openai", "gpt-4o-mini"))
            .apiKey("sk-test")
            .config(config)
            .build();

        assertThat(model).isInstanceOf(OpenAi.class);
        assertThat(model.getModelName()).isEqualTo("gpt-4o-mini");
    }

    @Test
    void providerAliases_areAccepted() {
        assertThat(LlmBuilder.from(new ModelConfiguration("claude", "claude-3-5-haiku-latest"))
            .apiKey("sk-ant").config(config).build()).isInstanceOf(Claude.class);
        assertThat(LlmBuilder.from(new ModelConfiguration("azure", "eval-deployment"))
            .apiKey("key").endpoint("https://contoso.openai.azure.com").config(config).build())
            .isInstanceOf(AzureOpenAi.class);
    }

    @Test
    void keyFromProperties_isUsed() {
        assumeTrue(System.getenv("ANTHROPIC_API_KEY") == null && System.getProperty("ANTHROPIC_API_KEY") == null);
        Properties properties = new Properties();
        properties.setProperty("anthropic.api.key", "from-properties");

        LanguageModel model = LlmBuilder.from(new ModelConfiguration("anthropic", "claude-3-5-sonnet-latest"))
            .config(new Config(properties))
            .build();

        assertThat(model.getProvider()).isEqualTo(LlmProvider.ANTHROPIC);
    }

    @Test
    void missingKey_isAuthenticationError() {
        assumeTrue(System.getenv("OPENAI_API_KEY") == null && System.getProperty("OPENAI_API_KEY") == null);

        assertThatThrownBy(() -> LlmBuilder.from(new ModelConfiguration("openai", "gpt-4o")).config(config).build())
            .isInstanceOf(LlmException.class)
            .hasMessage("API key is required for openai")
            .satisfies(e -> assertThat(((LlmException) e).getErrorType()).isEqualTo(LlmException.ErrorType.AUTHENTICATION));
    }

    @Test
    void azureWithoutEndpoint_isRejected() {
        assumeTrue(System.getenv("AZURE_OPENAI_ENDPOINT") == null && System.getProperty("AZURE_OPENAI_ENDPOINT") == null);

        assertThatThrownBy(() -> LlmBuilder.from(new ModelConfiguration("azure-openai", "eval"))
                .apiKey("key").config(config).build())
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("Azure OpenAI endpoint is required");
    }

    @Test
    void blankModel_isRejected() {
        assertThatThrownBy(() -> LlmBuilder.create().provider(LlmProvider.OPENAI).model(" ").apiKey("k").config(config).build())
            .isInstanceOf(LlmException.class)
            .hasMessage("Model name is required");
    }

    @Test
    void unknownProvider_isRejected() {
        assertThatThrownBy(() -> LlmProvider.fromName("cohere"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown provider 'cohere'");
    }
}
