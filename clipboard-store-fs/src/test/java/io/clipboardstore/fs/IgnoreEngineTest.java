package io.clipboardstore.fs;

import io.clipboardstore.core.MetadataFile;
import io.clipboardstore.spi.IgnoreOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class IgnoreEngineTest {

    @TempDir
    Path tempDir;

    private Clipboard clipboard;
    private final IgnoreEngine engine = new IgnoreEngine();

    @BeforeEach
    void setUp() {
        ClipboardPaths paths = new ClipboardPaths(tempDir.resolve("tmp"), tempDir.resolve("persist"), ClipboardPaths.persistencePredicate(false));
        clipboard = Clipboard.open(paths, "0", 0, new FakeProcessProbe(1), new RecordingPause());
    }

    @Test
    void testNoRulesLeavesEntryUntouched() throws Exception {
        Files.writeString(clipboard.rawPayload(), "hello");
        IgnoreOutcome outcome = engine.apply(clipboard);
        assertEquals(IgnoreOutcome.untouched(), outcome);
        assertFalse(outcome.changed());
        assertEquals("hello", Files.readString(clipboard.rawPayload()));
    }

    @Test
    void testRegexStripsMatchesFromRawPayload() throws Exception {
        Files.writeString(clipboard.rawPayload(), "user=alice token=abc123 end");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "token=\\w+\n\n\\s+end\n");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertTrue(outcome.contentRewritten());
        assertEquals(2, outcome.patternsApplied());
        assertEquals("user=alice", Files.readString(clipboard.rawPayload()));
    }

    @Test
    void testRegexMatchesEveryOccurrence() throws Exception {
        Files.writeString(clipboard.rawPayload(), "a1b22c333");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "[0-9]+");

        engine.apply(clipboard);

        assertEquals("abc", Files.readString(clipboard.rawPayload()));
    }

    @Test
    void testRegexRemovesMatchingFileNamesFromMultiItemEntry() throws Exception {
        Path entry = clipboard.entryDirectory();
        Files.writeString(entry.resolve("secret1.txt"), "hidden");
        Files.writeString(entry.resolve("keep.txt"), "visible");
        Files.createDirectories(entry.resolve("secretdir").resolve("inner"));
        Files.writeString(entry.resolve("secretdir").resolve("inner").resolve("x"), "x");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "^secret.*");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertFalse(Files.exists(entry.resolve("secret1.txt")));
        assertFalse(Files.exists(entry.resolve("secretdir")));
        assertEquals("visible", Files.readString(entry.resolve("keep.txt")));
        assertEquals(2, outcome.removed().size());
        assertFalse(outcome.contentRewritten());
    }

    @Test
    void testNameRulesRequireFullMatch() throws Exception {
        Path entry = clipboard.entryDirectory();
        Files.writeString(entry.resolve("mysecret.txt"), "x");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "secret");

        engine.apply(clipboard);

        assertTrue(Files.exists(entry.resolve("mysecret.txt")));
    }

    @Test
    void testInvalidPatternIsSkipped() throws Exception {
        Files.writeString(clipboard.rawPayload(), "keep [drop]");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "([unclosed\n\\[drop\\]");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertEquals(1, outcome.patternsApplied());
        assertEquals("keep ", Files.readString(clipboard.rawPayload()));
    }

    @Test
    void testNonUtf8PayloadKeepsSurroundingBytes() throws Exception {
        byte[] latin1 = "caf\u00e9 token=abc123 \u00fc".getBytes(StandardCharsets.ISO_8859_1);
        Files.write(clipboard.rawPayload(), latin1);
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "token=\\w+");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertTrue(outcome.contentRewritten());
        assertArrayEquals("caf\u00e9  \u00fc".getBytes(StandardCharsets.ISO_8859_1),
                Files.readAllBytes(clipboard.rawPayload()));
    }

    @Test
    void testBinaryPayloadWithoutMatchIsLeftAlone() throws Exception {
        byte[] binary = {(byte) 0xff, (byte) 0xfe, 0x00, 0x41};
        Files.write(clipboard.rawPayload(), binary);
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE), "B");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertFalse(outcome.contentRewritten());
        assertArrayEquals(binary, Files.readAllBytes(clipboard.rawPayload()));
    }

    @Test
    void testSecretDigestRedactsPayload() throws Exception {
        Files.writeString(clipboard.rawPayload(), "password123");
        String digest = IgnoreEngine.sha512Hex("password123".getBytes(StandardCharsets.UTF_8));
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE_SECRET), "deadbeef\n" + digest + "\n");

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertTrue(outcome.redacted());
        assertEquals(0L, Files.size(clipboard.rawPayload()));
    }

    @Test
    void testSecretDigestMismatchKeepsPayload() throws Exception {
        Files.writeString(clipboard.rawPayload(), "password123");
        String digest = IgnoreEngine.sha512Hex("password124".getBytes(StandardCharsets.UTF_8));
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE_SECRET), digest);

        IgnoreOutcome outcome = engine.apply(clipboard);

        assertFalse(outcome.redacted());
        assertEquals("password123", Files.readString(clipboard.rawPayload()));
    }

    @Test
    void testSecretsIgnoreMultiItemEntries() throws Exception {
        Path file = clipboard.entryDirectory().resolve("password.txt");
        Files.writeString(file, "password123");
        Files.writeString(clipboard.metadataFile(MetadataFile.IGNORE_SECRET),
                IgnoreEngine.sha512Hex("password123".getBytes(StandardCharsets.UTF_8)));

        assertFalse(engine.apply(clipboard).redacted());
        assertEquals("password123", Files.readString(file));
    }

    @Test
    void testSha512HexFormat() {
        String digest = IgnoreEngine.sha512Hex(new byte[0]);
        assertEquals(128, digest.length());
        assertTrue(digest.startsWith("cf83e1357eefb8bd"));
        assertEquals(digest.toLowerCase(), digest);
    }
}
