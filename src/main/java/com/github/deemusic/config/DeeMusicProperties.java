package com.github.deemusic.config;

import com.github.deemusic.model.AudioQuality;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "deemusic")
public class DeeMusicProperties {

    @Valid
    private Download download = new Download();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Catalog catalog = new Catalog();

    @Data
    public static class Download {
        @NotBlank
        private String outputDir = "./downloads";

        /**
         * Worker pool size; also the upper bound of items downloading at once.
         */
        @Min(1)
        @Max(32)
        private int concurrentDownloads = 8;

        @NotNull
        private AudioQuality quality = AudioQuality.MP3_320;

        @Min(0)
        private long progressIntervalMs = 500;
    }

    @Data
    public static class Retry {
        @Min(0)
        @Max(10)
        private int maxRetries = 3;

        @Min(0)
        private long initialDelayMs = 2000;

        @Min(1)
        private int multiplier = 2;

        @Min(0)
        private long maxDelayMs = 30000;
    }

    @Data
    public static class Scheduler {
        @Min(10)
        private long idlePollMs = 1000;
    }

    @Data
    public static class Catalog {
        @NotBlank
        private String baseUrl = "http://localhost:8090/api";

        @Min(1)
        private int timeoutSeconds = 30;

        @NotBlank
        private String userAgent = "DeeMusic/1.0";

        private String arl;

        public boolean hasCredential() {
            return arl != null && !arl.isBlank();
        }
    }
}
