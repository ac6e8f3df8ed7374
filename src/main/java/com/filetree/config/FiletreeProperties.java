package com.filetree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw export configuration bound from {@code application.yml}, environment
 * variables ({@code FILETREE_ROOT_DIR}, {@code FILETREE_EXCLUDES}, ...) and
 * {@code --filetree.*} arguments.
 * <p>
 * Resolved into an immutable {@link ExportSettings} before use.
 */
@Component
@ConfigurationProperties(prefix = "filetree")
public class FiletreeProperties {

    public static final List<String> DEFAULT_EXCLUDES = List.of(
            ".git", "node_modules", "__pycache__", ".venv", ".mypy_cache"
    );

    private String rootDir = ".";
    private String output = "FILETREE.md";
    private List<String> excludes = new ArrayList<>(DEFAULT_EXCLUDES);
    private String ignoreFile = ".filetreeignore";
    private boolean includeHidden = true;
    private long maxBytes = 300_000;
    private boolean readBinary = false;
    private Icons icons = new Icons();

    public String getRootDir() { return rootDir; }
    public void setRootDir(String rootDir) { this.rootDir = rootDir; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public List<String> getExcludes() { return excludes; }
    public void setExcludes(List<String> excludes) { this.excludes = excludes; }

    public String getIgnoreFile() { return ignoreFile; }
    public void setIgnoreFile(String ignoreFile) { this.ignoreFile = ignoreFile; }

    public boolean isIncludeHidden() { return includeHidden; }
    public void setIncludeHidden(boolean includeHidden) { this.includeHidden = includeHidden; }

    public long getMaxBytes() { return maxBytes; }
    public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

    public boolean isReadBinary() { return readBinary; }
    public void setReadBinary(boolean readBinary) { this.readBinary = readBinary; }

    public Icons getIcons() { return icons; }
    public void setIcons(Icons icons) { this.icons = icons; }

    public static class Icons {
        private String selected = "◉";
        private String unselected = "◯";
        private String mixed = "◐";

        public String getSelected() {
            return selected;
        }

        public void setSelected(String selected) {
            this.selected = selected;
        }

        public String getUnselected() {
            return unselected;
        }

        public void setUnselected(String unselected) {
            this.unselected = unselected;
        }

        public String getMixed() {
            return mixed;
        }

        public void setMixed(String mixed) {
            this.mixed = mixed;
        }
    }
}
