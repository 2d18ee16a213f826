package org.webcdu.cdu;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path root;

    @TempDir
    Path outside;

    @Test
    void resolveFile_acceptsRelativeAndAbsolutePathsInsideRoot() throws Exception {
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/x.cdu"), "DCDU");
        SecurePathResolver resolver = new SecurePathResolver(properties(false));

        SecurePathResolver.ResolvedPath relative = resolver.resolveFile(null, "a/../a/x.cdu");
        SecurePathResolver.ResolvedPath absolute = resolver.resolveFile(null, root.resolve("a/x.cdu").toString());

        assertThat(relative.rootId()).isEqualTo("root0");
        assertThat(relative.displayPath()).isEqualTo("a/x.cdu");
        assertThat(absolute.absolutePath()).isEqualTo(relative.absolutePath());
        assertThat(resolver.listRoots()).hasSize(1);
    }

    @Test
    void resolveFile_rejectsTraversalMissingFilesAndDirectories() throws Exception {
        Files.writeString(outside.resolve("segredo.cdu"), "DCDU");
        Files.createDirectories(root.resolve("dir"));
        SecurePathResolver resolver = new SecurePathResolver(properties(false));

        String escape = root.relativize(outside.resolve("segredo.cdu")).toString();
        assertThatThrownBy(() -> resolver.resolveFile(null, escape))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("根目录");
        assertThatThrownBy(() -> resolver.resolveFile(null, outside.resolve("segredo.cdu").toString()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveFile(null, "nao-existe.cdu"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveFile(null, "dir"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveFile("root9", "x.cdu"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveFile(null, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveFile_rejectsSymlinkUnlessAllowedAndStillInside() throws Exception {
        Files.writeString(root.resolve("real.cdu"), "DCDU");
        Files.writeString(outside.resolve("fora.cdu"), "DCDU");
        Files.createSymbolicLink(root.resolve("link.cdu"), root.resolve("real.cdu"));
        Files.createSymbolicLink(root.resolve("escape.cdu"), outside.resolve("fora.cdu"));

        assertThatThrownBy(() -> new SecurePathResolver(properties(false)).resolveFile(null, "link.cdu"))
                .isInstanceOf(IllegalArgumentException.class);

        SecurePathResolver permissive = new SecurePathResolver(properties(true));
        assertThat(permissive.resolveFile(null, "link.cdu").displayPath()).isEqualTo("link.cdu");
        assertThatThrownBy(() -> permissive.resolveFile(null, "escape.cdu"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private CduServerProperties properties(boolean allowSymlink) {
        CduServerProperties properties = new CduServerProperties();
        properties.setRoots(List.of(root.toString()));
        properties.setAllowSymlink(allowSymlink);
        return properties;
    }
}
