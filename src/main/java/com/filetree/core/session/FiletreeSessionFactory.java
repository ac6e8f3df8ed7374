package com.filetree.core.session;

import com.filetree.config.ExportSettings;
import com.filetree.config.FiletreeProperties;
import com.filetree.config.RootDirectoryNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the bound {@link FiletreeProperties} and opens a session on them.
 */
@Service
public class FiletreeSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(FiletreeSessionFactory.class);

    private final FiletreeProperties properties;

    public FiletreeSessionFactory(FiletreeProperties properties) {
        this.properties = properties;
    }

    /**
     * Opens a session on {@code rootOverride} instead of the configured root, if given.
     *
     * @throws RootDirectoryNotFoundException if the root is missing
     * @throws IllegalArgumentException       if a limit is out of range
     */
    public FiletreeSession open(String rootOverride) {
        ExportSettings settings = resolve(rootOverride);
        log.debug("Opening session on {} with excludes {}", settings.root(), settings.excludes());
        return FiletreeSession.open(settings);
    }

    /** Resolved settings without opening a session. */
    public ExportSettings resolve(String rootOverride) {
        return ExportSettings.resolve(properties, rootOverride);
    }
}
