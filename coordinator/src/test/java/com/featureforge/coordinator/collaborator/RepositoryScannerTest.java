package com.featureforge.coordinator.collaborator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryScannerTest {

    @TempDir Path repo;

    private final RepositoryScanner scanner = new RepositoryScanner();

    // ------------------------------------------------------------------
    // listFiles() / structure()
    // ------------------------------------------------------------------

    @Test
    void listFiles_skipsDefaultIgnores() throws IOException {
        write("app/main.py", "print('hi')");
        write("app/__pycache__/main.cpython-311.pyc", "");
        write("app/util.pyc", "");
        write(".git/HEAD", "ref: refs/heads/main");
        write("node_modules/left-pad/index.js", "");
        write(".env", "SECRET=1");
        write("server.log", "");
        write("README.md", "# demo");

        assertThat(scanner.listFiles(repo)).containsExactly("README.md", "app/main.py");
    }

    @Test
    void listFiles_honoursGitignore() throws IOException {
        write(".gitignore", """
                # build output
                build/
                /secrets.txt
                docs/*.tmp
                !keep.me
                """);
        write("build/out.class", "");
        write("src/build/nested.txt", "");
        write("secrets.txt", "");
        write("src/secrets.txt", "");
        write("docs/draft.tmp", "");
        write("docs/guide.md", "");

        assertThat(scanner.listFiles(repo)).containsExactly(
                ".gitignore", "docs/guide.md", "src/secrets.txt");
    }

    @Test
    void structure_isSortedNewlineSeparated() throws IOException {
        write("b.py", "");
        write("a/c.py", "");

        assertThat(scanner.structure(repo)).isEqualTo("a/c.py\nb.py");
    }

    @Test
    void listFiles_notADirectory_throws() {
        assertThatThrownBy(() -> scanner.listFiles(repo.resolve("missing")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // readExisting()
    // ------------------------------------------------------------------

    @Test
    void readExisting_skipsFilesThatDoNotExistYet() throws IOException {
        write("models.py", "class User: pass");

        Map<String, String> contents = scanner.readExisting(repo, List.of("models.py", "views.py"));

        assertThat(contents).containsOnly(Map.entry("models.py", "class User: pass"));
    }

    @Test
    void readExisting_pathOutsideRoot_isRejected() {
        assertThatThrownBy(() -> scanner.readExisting(repo, List.of("../etc/passwd")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("escapes");
    }

    @Test
    void readExisting_binaryFile_isRejectedAsNotText() throws IOException {
        Files.write(repo.resolve("logo.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G', (byte) 0xFF, (byte) 0xFE});

        assertThatThrownBy(() -> scanner.readExisting(repo, List.of("logo.png")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("logo.png");
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
