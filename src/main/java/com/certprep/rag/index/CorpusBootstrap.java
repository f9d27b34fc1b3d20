package com.certprep.rag.index;

import com.certprep.rag.configuration.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the configured corpus into the index once, at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorpusBootstrap implements ApplicationRunner {

    private final AppProperties props;
    private final CorpusIngestService ingestService;

    @Override
    public void run(ApplicationArguments args) {
        String corpusFile = props.getIndex().getCorpusFile();
        if (!props.getIndex().isLoadOnStartup() || corpusFile == null || corpusFile.isBlank()) {
            log.info("No corpus configured for startup loading; index '{}' is served as-is",
                    props.getIndex().getCollectionName());
            return;
        }

        Path path = Path.of(corpusFile);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Configured corpus file does not exist: " + path.toAbsolutePath());
        }
        ingestService.ingest(path);
    }
}
