package com.filetree.core.content;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file extensions to Markdown code-fence language tags.
 */
public final class LanguageTags {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".py", "python"),
            Map.entry(".js", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".json", "json"),
            Map.entry(".yml", "yaml"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".toml", "toml"),
            Map.entry(".ini", "ini"),
            Map.entry(".sh", "bash"),
            Map.entry(".md", "markdown"),
            Map.entry(".html", "html"),
            Map.entry(".css", "css"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".java", "java"),
            Map.entry(".c", "c"),
            Map.entry(".h", "c"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".hpp", "cpp"),
            Map.entry(".rb", "ruby"),
            Map.entry(".php", "php")
    );

    private LanguageTags() {}

    /** Fence tag for {@code path}, or an empty string when the extension is unknown. */
    public static String forPath(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? "" : forFileName(fileName.toString());
    }

    public static String forFileName(String name) {
        return BY_EXTENSION.getOrDefault(extension(name), "");
    }

    // ".bashrc" has no extension, "archive.tar.gz" has ".gz"
    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
