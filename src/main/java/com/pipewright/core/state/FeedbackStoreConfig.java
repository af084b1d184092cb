package com.pipewright.core.state;

import com.pipewright.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Provides the {@link FeedbackStore} bean.
 * <p>
 * When {@code pipewright.state.file} is set, loops are persisted to that JSON file and reloaded
 * on start. Otherwise an in-memory store is used, which loses its state on restart.
 */
@Configuration
public class FeedbackStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(FeedbackStoreConfig.class);

    @Bean
    public FeedbackStore feedbackStore(PipelineProperties properties) {
        String file = properties.getState().getFile();
        if (file != null && !file.isBlank()) {
            log.info("Configuring JSON file feedback store at {}", file);
            return new JsonFileFeedbackStore(Path.of(file));
        }
        log.info("No state file configured; using in-memory feedback store (state will not persist across restarts)");
        return new FeedbackStore();
    }
}
