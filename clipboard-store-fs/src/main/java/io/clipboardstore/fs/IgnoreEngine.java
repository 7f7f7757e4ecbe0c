package io.clipboardstore.fs;

import io.clipboardstore.core.ClipboardStoreException;
import io.clipboardstore.core.MetadataFile;
import io.clipboardstore.spi.IgnoreOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Applies the ignore rules of a clipboard to its active entry.
 *
 * <p>Two independent passes, both destructive:
 * <ul>
 *   <li>regex rules ({@code metadata/ignore}): on a raw payload every match is cut out of the text;
 *       on a multi-file entry every top-level child whose name fully matches is deleted</li>
 *   <li>secret rules ({@code metadata/ignore_secret}): if the SHA-512 of a raw payload equals one of the
 *       listed digests, the payload is emptied</li>
 * </ul>
 */
public final class IgnoreEngine {

    private static final Logger LOG = LoggerFactory.getLogger(IgnoreEngine.class);
    private static final String DIGEST_ALGORITHM = "SHA-512";

    public IgnoreOutcome apply(Clipboard clipboard) {
        Path ignore = clipboard.metadataFile(MetadataFile.IGNORE);
        Path secrets = clipboard.metadataFile(MetadataFile.IGNORE_SECRET);
        if (FileContents.isEmpty(ignore) && FileContents.isEmpty(secrets)) return IgnoreOutcome.untouched();

        int patternsApplied = 0;
        List<Path> removed = new ArrayList<>();
        boolean rewritten = false;

        if (!FileContents.isEmpty(ignore)) {
            List<Pattern> patterns = ignorePatterns(ignore);
            patternsApplied = patterns.size();
            if (clipboard.holdsRawDataInCurrentEntry()) {
                rewritten = stripMatches(clipboard.rawPayload(), patterns);
            } else {
                removed.addAll(removeMatchingChildren(clipboard.entryDirectory(), patterns));
            }
        }

        boolean redacted = false;
        if (!FileContents.isEmpty(secrets) && clipboard.holdsRawDataInCurrentEntry()) {
            redacted = redactSecret(clipboard.rawPayload(), ignoreSecrets(secrets));
        }

        return new IgnoreOutcome(patternsApplied, removed, rewritten, redacted);
    }

    /**
     * Compiled patterns from a rule file, in file order. Blank lines and invalid patterns are skipped.
     */
    static List<Pattern> ignorePatterns(Path file) {
        List<Pattern> patterns = new ArrayList<>();
        for (String line : ruleLines(file)) {
            try {
                patterns.add(Pattern.compile(line));
            } catch (PatternSyntaxException e) {
                LOG.warn("Skipping invalid ignore pattern \"{}\": {}", line, e.getDescription());
            }
        }
        return patterns;
    }

    static List<String> ignoreSecrets(Path file) {
        return ruleLines(file).stream()
                .map(line -> line.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    private static List<String> ruleLines(Path file) {
        try {
            return FileContents.lines(file);
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Cannot read rules {}: {}", file, e.toString());
            return List.of();
        }
    }

    private static boolean stripMatches(Path raw, List<Pattern> patterns) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(raw);
        } catch (IOException e) {
            LOG.warn("Cannot read payload {}: {}", raw, e.toString());
            return false;
        }

        // ISO-8859-1 maps every byte to one char, so non-UTF-8 payloads round-trip unchanged
        Charset charset = StandardCharsets.UTF_8;
        String content;
        try {
            content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            LOG.debug("Payload {} is not UTF-8 text; matching it byte-wise", raw);
            charset = StandardCharsets.ISO_8859_1;
            content = new String(bytes, charset);
        }

        String result = content;
        for (Pattern pattern : patterns) {
            result = pattern.matcher(result).replaceAll("");
        }
        if (result.equals(content)) return false;

        byte[] rewritten = result.getBytes(charset);
        try {
            Files.write(raw, rewritten);
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot rewrite payload " + raw, e);
        }
        LOG.info("Removed {} ignored bytes from {}", bytes.length - rewritten.length, raw);
        return true;
    }

    private static List<Path> removeMatchingChildren(Path entry, List<Pattern> patterns) {
        List<Path> removed = new ArrayList<>();
        for (Pattern pattern : patterns) {
            List<Path> matches;
            try (Stream<Path> children = Files.list(entry)) {
                matches = children.filter(child -> pattern.matcher(child.getFileName().toString()).matches())
                        .collect(Collectors.toList());
            } catch (IOException e) {
                LOG.warn("Cannot list entry {}: {}", entry, e.toString());
                return removed;
            }
            for (Path match : matches) {
                try {
                    FileContents.deleteRecursively(match);
                } catch (IOException e) {
                    throw new ClipboardStoreException.StorageFailure("Cannot remove ignored item " + match, e);
                }
                LOG.info("Removed ignored item {}", match);
                removed.add(match);
            }
        }
        return removed;
    }

    private static boolean redactSecret(Path raw, List<String> secrets) {
        String digest;
        try {
            digest = sha512Hex(Files.readAllBytes(raw));
        } catch (IOException e) {
            LOG.warn("Cannot read payload {}: {}", raw, e.toString());
            return false;
        }
        for (String secret : secrets) {
            if (secret.equals(digest)) {
                try {
                    Files.write(raw, new byte[0]);
                } catch (IOException e) {
                    throw new ClipboardStoreException.StorageFailure("Cannot redact payload " + raw, e);
                }
                LOG.info("Redacted payload {} matching an ignored secret", raw);
                return true;
            }
        }
        return false;
    }

    /**
     * Lowercase hex SHA-512 digest, the format expected in {@code metadata/ignore_secret}.
     */
    public static String sha512Hex(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(DIGEST_ALGORITHM).digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }
}
