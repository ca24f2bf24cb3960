package xyz.vvrf.reactor.build.fingerprint;

import com.google.common.hash.Hashing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.ErrorKind;
import xyz.vvrf.reactor.build.core.FilesystemException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class FingerprinterTest {

    @TempDir
    Path dir;

    private Fingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new Fingerprinter(Schedulers.parallel(), 8);
    }

    private void write(String relative, String content) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void smallContentHashesDirectly() {
        byte[] bytes = "hello".getBytes(StandardCharsets.UTF_8);
        assertEquals(Digest.of(Hashing.sha256().hashBytes(bytes)), fingerprinter.fingerprint(bytes));
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", fingerprinter.fingerprint(bytes).hex());
    }

    @Test
    void largeContentIsChunked() {
        byte[] big = new byte[Digests.CHUNK_SIZE * 2 + 10];
        Arrays.fill(big, (byte) 7);
        Digest chunked = fingerprinter.fingerprint(big);
        assertNotEquals(Digest.of(Hashing.sha256().hashBytes(big)), chunked);
        assertEquals(chunked, fingerprinter.fingerprint(big.clone()));
    }

    @Test
    void fileAndStreamDigestsAgree() throws IOException {
        byte[] big = new byte[Digests.CHUNK_SIZE * 3 + 1];
        for (int i = 0; i < big.length; i++) {
            big[i] = (byte) (i % 251);
        }
        Path file = dir.resolve("big.bin");
        Files.write(file, big);
        assertEquals(Digests.ofContent(big), Digests.ofFile(file));
    }

    @Test
    void directoryDigestIsDeterministic() throws IOException {
        write("b.txt", "B");
        write("a/x.txt", "X");
        write("a/y.txt", "Y");

        Digest first = fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty());
        Digest second = new Fingerprinter(Schedulers.boundedElastic(), 1).fingerprintBlocking(dir, IgnoreRules.empty());
        assertEquals(first, second);
    }

    @Test
    void renameChangesDirectoryDigest() throws IOException {
        write("a.txt", "same");
        Digest before = fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty());
        Files.move(dir.resolve("a.txt"), dir.resolve("b.txt"));
        Digest after = fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty());
        assertNotEquals(before, after);
    }

    @Test
    void contentChangeChangesDirectoryDigest() throws IOException {
        write("src/main.c", "int main() { return 0; }");
        Digest before = fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty());
        write("src/main.c", "int main() { return 1; }");
        assertNotEquals(before, fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty()));
    }

    @Test
    void ignoredEntriesDoNotAffectDigest() throws IOException {
        write("src/app.txt", "app");
        Digest clean = fingerprinter.fingerprintBlocking(dir, IgnoreRules.parse("build/\n*.log"));

        write("build/out.bin", "generated");
        write("debug.log", "noise");
        assertEquals(clean, fingerprinter.fingerprintBlocking(dir, IgnoreRules.parse("build/\n*.log")));
        assertNotEquals(clean, fingerprinter.fingerprintBlocking(dir, IgnoreRules.empty()));
    }

    @Test
    void reincludedFileUnderIgnoredDirectoryIsFingerprinted() throws IOException {
        IgnoreRules rules = IgnoreRules.parse("build\n!build/keep.txt");
        write("src/app.txt", "app");
        write("build/out.bin", "generated");
        write("build/keep.txt", "v1");
        Digest before = fingerprinter.fingerprintBlocking(dir, rules);

        write("build/out.bin", "regenerated");
        assertEquals(before, fingerprinter.fingerprintBlocking(dir, rules));

        write("build/keep.txt", "v2");
        assertNotEquals(before, fingerprinter.fingerprintBlocking(dir, rules));
    }

    @Test
    void wildcardNegationReachesNestedIgnoredDirectories() throws IOException {
        IgnoreRules rules = IgnoreRules.parse("out/*\n!out/*.keep");
        write("out/deep/a.keep", "v1");
        write("out/deep/b.tmp", "tmp");
        Digest before = fingerprinter.fingerprintBlocking(dir, rules);

        write("out/deep/b.tmp", "tmp2");
        assertEquals(before, fingerprinter.fingerprintBlocking(dir, rules));

        write("out/deep/a.keep", "v2");
        assertNotEquals(before, fingerprinter.fingerprintBlocking(dir, rules));
    }

    @Test
    void contextUsesDockerIgnore() throws IOException {
        write("keep.txt", "k");
        write(".dockerignore", "skip.txt\n.dockerignore");
        Digest before = fingerprinter.fingerprintContext(dir).block();
        write("skip.txt", "s");
        assertEquals(before, fingerprinter.fingerprintContext(dir).block());
    }

    @Test
    void missingPathFailsWithFilesystemError() {
        StepVerifier.create(fingerprinter.fingerprint(dir.resolve("absent"), IgnoreRules.empty()))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof FilesystemException);
                    assertEquals(ErrorKind.FILESYSTEM, ((FilesystemException) e).getKind());
                })
                .verify();
    }

    @Test
    void singleFileFingerprintIsItsContentDigest() throws IOException {
        write("one.txt", "content");
        assertEquals(Digests.ofString("content"), fingerprinter.fingerprintBlocking(dir.resolve("one.txt"), null));
    }
}
