package com.tmdbsync.ingestion.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BearerTokenLoaderTest {

    @TempDir
    Path dir;

    @Test
    void load_skipsCommentsAndStripsQuotes() throws Exception {
        Path env = Files.writeString(dir.resolve(".env"), """
                # TMDB credentials
                OTHER=1

                TMDB_bearer="abc.def"
                """);
        assertThat(BearerTokenLoader.load(env)).isEqualTo("abc.def");
    }

    @Test
    void load_acceptsUpperCaseKey() throws Exception {
        Path env = Files.writeString(dir.resolve(".env"), "TMDB_BEARER = 'xyz'\n");
        assertThat(BearerTokenLoader.load(env)).isEqualTo("xyz");
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> BearerTokenLoader.load(dir.resolve("absent.env")))
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_missingKey_throws() throws Exception {
        Path env = Files.writeString(dir.resolve(".env"), "TMDB_API_KEY=123\nTMDB_bearer=\n");
        assertThatThrownBy(() -> BearerTokenLoader.load(env))
                .isInstanceOf(MissingCredentialsException.class)
                .hasMessageContaining("TMDB_bearer");
    }
}
