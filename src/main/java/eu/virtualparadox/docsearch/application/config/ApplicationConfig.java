package eu.virtualparadox.docsearch.application.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Filesystem layout of the application: Lucene index, manifest database, models and the
 * default document directory scanned by {@code indexDirectory}.
 * <p>
 * Every location left unset is derived from {@code docsearch.root}.
 */
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "docsearch")
@Getter @Setter
public class ApplicationConfig {

    private Path root = Path.of(System.getProperty("user.home"), ".docsearch");
    private Path index;
    private Path db;
    private Path models;
    private Path documents;

    /** Index {@link #documents} when the application starts. */
    private boolean indexOnStartup;

    @PostConstruct
    public void resolveLayout() throws IOException {
        if (index == null) index = root.resolve("index");
        if (db == null) db = root.resolve("db").resolve("manifest");
        if (models == null) models = root.resolve("models");
        if (documents == null) documents = root.resolve("documents");

        Files.createDirectories(root);
        Files.createDirectories(index);
        Files.createDirectories(models);
        final Path dbDir = db.getParent();
        if (dbDir != null) Files.createDirectories(dbDir);

        log.info("Data directory {} (index {}, manifest {}, models {})", root, index, db, models);
    }
}
