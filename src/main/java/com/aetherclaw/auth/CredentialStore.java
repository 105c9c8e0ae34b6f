package com.aetherclaw.auth;

import com.aetherclaw.shared.config.RuntimeEnv;
import com.aetherclaw.shared.model.ChannelBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps the Telegram binding in a {@code KEY=value} env file. Only the binding's own lines
 * are touched; everything else in the file survives unchanged and in order.
 */
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    public static final String TOKEN_KEY = "TELEGRAM_BOT_TOKEN";
    public static final String CHAT_ID_KEY = "TELEGRAM_CHAT_ID";

    // latin-1 maps every byte to one char and back, so untouched lines are rewritten byte for byte
    private static final Charset FILE_CHARSET = StandardCharsets.ISO_8859_1;
    private static final Pattern TELEGRAM_ENTRY = Pattern.compile(
            "^\\s*(" + TOKEN_KEY + "|" + CHAT_ID_KEY + ")\\s*=", Pattern.MULTILINE);

    // the file holds the bot token
    private static final String NEW_FILE_PERMISSIONS = "rw-------";

    private final Path envFile;

    public CredentialStore(Path envFile) {
        this.envFile = envFile;
    }

    public Path envFile() {
        return envFile;
    }

    public void save(ChannelBinding binding) throws IOException {
        var values = new LinkedHashMap<String, String>();
        values.put(TOKEN_KEY, binding.token());
        values.put(CHAT_ID_KEY, binding.conversationId());

        var existing = Files.exists(envFile) ? Files.readString(envFile, FILE_CHARSET) : "";
        var merged = merge(existing, values);

        var parent = envFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        var tmp = envFile.resolveSibling(envFile.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, merged, FILE_CHARSET);
            // the move replaces the inode, so the old file's mode has to travel with the new one
            restrictPermissions(tmp);
            try {
                Files.move(tmp, envFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, envFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }

        values.forEach(RuntimeEnv::set);
        log.info("Saved Telegram binding for chat {} to {}", binding.conversationId(), envFile);
    }

    private void restrictPermissions(Path tmp) throws IOException {
        if (!tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) return;
        var permissions = Files.exists(envFile)
                ? Files.getPosixFilePermissions(envFile)
                : PosixFilePermissions.fromString(NEW_FILE_PERMISSIONS);
        Files.setPosixFilePermissions(tmp, permissions);
    }

    public Optional<ChannelBinding> load() throws IOException {
        if (!Files.exists(envFile)) return Optional.empty();
        String token = null;
        String chatId = null;
        for (var line : Files.readAllLines(envFile, FILE_CHARSET)) {
            if (line.startsWith(TOKEN_KEY + "=")) token = line.substring(TOKEN_KEY.length() + 1).trim();
            if (line.startsWith(CHAT_ID_KEY + "=")) chatId = line.substring(CHAT_ID_KEY.length() + 1).trim();
        }
        if (token == null || token.isEmpty() || chatId == null || chatId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ChannelBinding(token, chatId));
    }

    /** True when the file already mentions either Telegram key, even with an empty value. */
    public boolean hasTelegramEntries() {
        if (!Files.exists(envFile)) return false;
        try {
            return TELEGRAM_ENTRY.matcher(Files.readString(envFile, FILE_CHARSET)).find();
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", envFile, e.getMessage());
            return false;
        }
    }

    /**
     * Replaces the value of every line starting with {@code KEY=} for the given keys and
     * appends the keys that were not found, in map order.
     */
    static String merge(String content, Map<String, String> values) {
        var out = new StringBuilder(content.length() + 64);
        var found = new ArrayList<String>();

        for (var line : splitKeepingTerminators(content)) {
            var key = matchingKey(line, values);
            if (key == null) {
                out.append(line);
                continue;
            }
            found.add(key);
            out.append(key).append('=').append(values.get(key)).append(terminatorOf(line));
        }

        var missing = new ArrayList<String>();
        for (var key : values.keySet()) {
            if (!found.contains(key)) missing.add(key);
        }
        if (!missing.isEmpty() && out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        for (var key : missing) {
            out.append(key).append('=').append(values.get(key)).append('\n');
        }
        return out.toString();
    }

    private static String matchingKey(String line, Map<String, String> values) {
        for (var key : values.keySet()) {
            if (line.startsWith(key + "=")) return key;
        }
        return null;
    }

    private static List<String> splitKeepingTerminators(String content) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length()) lines.add(content.substring(start));
        return lines;
    }

    private static String terminatorOf(String line) {
        if (line.endsWith("\r\n")) return "\r\n";
        if (line.endsWith("\n")) return "\n";
        return "";
    }
}
