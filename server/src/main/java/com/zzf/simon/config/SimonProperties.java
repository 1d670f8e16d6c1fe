package com.zzf.simon.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "simon")
public class SimonProperties {
    private Stream stream = new Stream();
    private Llm llm = new Llm();
    private Store store = new Store();
    private Tools tools = new Tools();
    private Auth auth = new Auth();

    @Data
    public static class Stream {
        private Duration keepAlive = Duration.ofSeconds(15);
        private Duration timeout = Duration.ofMinutes(5);
        private int bufferSize = 100;
        private int historyLimit = 20;
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String classifierModel = "gpt-4o-mini";
        private Duration timeout = Duration.ofSeconds(60);
        private double temperature = 0.7;
    }

    @Data
    public static class Store {
        /** {@code file} or {@code memory}. */
        private String type = "file";
        private String directory = "./data/store";
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(5);
        private double multiplier = 2.0;
    }

    @Data
    public static class Tools {
        private RateLimit rateLimit = new RateLimit();
        private Entitlements entitlements = new Entitlements();
    }

    @Data
    public static class RateLimit {
        private int capacity = 20;
        private Duration window = Duration.ofMinutes(1);
    }

    @Data
    public static class Entitlements {
        private List<String> proOnly = new ArrayList<>();
        private List<String> proUsers = new ArrayList<>();
    }

    @Data
    public static class Auth {
        /** Bearer token to uid. */
        private Map<String, String> devTokens = new LinkedHashMap<>();
        private boolean allowHeaderUid = false;
    }
}
