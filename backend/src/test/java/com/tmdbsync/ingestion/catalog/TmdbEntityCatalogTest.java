package com.tmdbsync.ingestion.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TmdbEntityCatalogTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final NdjsonCodec codec = new NdjsonCodec(mapper);

    @Test
    void all_isInDependencyOrder() {
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        assertThat(catalog.all()).extracting(SyncEntity::name).containsExactly(
                "ref_languages", "ref_countries", "ref_genre_movies", "ref_genre_series",
                "certification_movies", "certification_series",
                "movie_details", "movie_alternative_titles", "movie_credits", "movie_external_ids",
                "movie_keywords", "movie_release_dates", "movie_reviews", "movie_translations",
                "watch_providers_movies",
                "people_details", "company_details", "tv_networks_details",
                "tv_series_details", "tv_series_alternative_titles", "tv_series_content_ratings",
                "tv_series_external_ids", "tv_series_reviews", "tv_series_translations",
                "watch_providers_series",
                "tv_seasons_details", "tv_episodes_details");
    }

    @Test
    void select_keepsCatalogOrderAndRejectsUnknownNames() {
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        assertThat(catalog.select(List.of("tv_seasons_details", " ref_countries"))).extracting(SyncEntity::name)
                .containsExactly("ref_countries", "tv_seasons_details");
        assertThat(catalog.select(List.of())).hasSize(27);
        assertThatThrownBy(() -> catalog.select(List.of("nope"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void endpoints_followTheApiLayout() {
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        EntityDescriptor episodes = (EntityDescriptor) catalog.find("tv_episodes_details").orElseThrow();
        EntityDescriptor reviews = (EntityDescriptor) catalog.find("movie_reviews").orElseThrow();

        assertThat(episodes.endpoint().apply(IdentityKey.of(1399, 1, 5))).isEqualTo("/tv/1399/season/1/episode/5");
        assertThat(reviews.endpoint().apply(IdentityKey.of(550))).isEqualTo("/movie/550/reviews");
        assertThat(episodes.keySchema().fields()).containsExactly("series_id", "season_number", "episode_number");
    }

    @Test
    void subresources_hangOffTheirOwner() {
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        EntityDescriptor credits = (EntityDescriptor) catalog.find("movie_credits").orElseThrow();
        EntityDescriptor ratings = (EntityDescriptor) catalog.find("tv_series_content_ratings").orElseThrow();
        EntityDescriptor networks = (EntityDescriptor) catalog.find("tv_networks_details").orElseThrow();

        assertThat(credits.endpoint().apply(IdentityKey.of(550))).isEqualTo("/movie/550/credits");
        assertThat(ratings.endpoint().apply(IdentityKey.of(1399))).isEqualTo("/tv/1399/content_ratings");
        assertThat(networks.endpoint().apply(IdentityKey.of(49))).isEqualTo("/network/49");
        assertThat(credits.keySchema().fields()).containsExactly("id");
    }

    @Test
    void watchProviders_areGroupedByOwnerId() {
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        EntityDescriptor movies = (EntityDescriptor) catalog.find("watch_providers_movies").orElseThrow();
        EntityDescriptor series = (EntityDescriptor) catalog.find("watch_providers_series").orElseThrow();

        assertThat(movies.endpoint().apply(IdentityKey.of(550))).isEqualTo("/movie/550/watch/providers");
        assertThat(series.endpoint().apply(IdentityKey.of(1399))).isEqualTo("/tv/1399/watch/providers");
        assertThat(movies.keySchema().fields()).containsExactly("id_movie");
        assertThat(series.keySchema().fields()).containsExactly("id_series");
    }

    @Test
    void seriesRefreshPolicy_followsStatusTable() throws Exception {
        RefreshPolicy policy = TmdbEntityCatalog.seriesRefreshPolicy();
        LocalDate today = LocalDate.of(2026, 10, 17);

        assertThat(policy.isDue(mapper.readTree("{\"status\":\"Returning Series\",\"last_air_date\":\"2001-01-01\"}"), today)).isTrue();
        assertThat(policy.isDue(mapper.readTree("{\"status\":\"Canceled\",\"last_air_date\":\"2026-01-01\"}"), today)).isTrue();
        assertThat(policy.isDue(mapper.readTree("{\"status\":\"In Production\",\"last_air_date\":\"2026-09-01\"}"), today)).isFalse();
    }

    @Test
    void genreCalls_comeFromTheLanguagesStore() throws Exception {
        Files.writeString(dir.resolve("ref_languages.ndjson"), "{\"iso_639_1\":\"fr\"}\n{\"iso_639_1\":\"de\"}\n");
        TmdbEntityCatalog catalog = new TmdbEntityCatalog(dir, codec);

        RebuildDescriptor genres = (RebuildDescriptor) catalog.find("ref_genre_movies").orElseThrow();

        assertThat(genres.calls().calls()).extracting(RebuildCall::label).containsExactly("fr", "de");
        assertThat(genres.calls().calls().get(0).queryParams()).containsEntry("language", "fr");

        RebuildDescriptor seriesGenres = (RebuildDescriptor) catalog.find("ref_genre_series").orElseThrow();
        assertThat(seriesGenres.calls().calls()).extracting(RebuildCall::path)
                .containsExactly("/genre/tv/list", "/genre/tv/list");
    }
}
