package ch.so.arp.courserag.llm;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to connect to the Anthropic Messages
 * API.
 */
@ConfigurationProperties(prefix = "rag.anthropic")
public class AnthropicClientProperties implements EnvironmentAware {

    /**
     * API key that authorises requests. Falls back to the ANTHROPIC_API_KEY
     * environment variable.
     */
    private String apiKey;

    /**
     * Base URL for the API. Defaults to the public Anthropic endpoint.
     */
    private String baseUrl = "https://api.anthropic.com/v1";

    /**
     * Name of the model that should be used.
     */
    private String model = "claude-sonnet-4-20250514";

    private String apiVersion = "2023-06-01";

    private int maxTokens = 800;

    private double temperature = 0.0d;

    /**
     * Timeout applied to every request.
     */
    private Duration timeout = Duration.ofSeconds(60);

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("ANTHROPIC_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
