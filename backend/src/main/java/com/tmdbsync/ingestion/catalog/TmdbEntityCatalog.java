package com.tmdbsync.ingestion.catalog;

import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.candidate.NestedKeyListing;
import com.tmdbsync.ingestion.candidate.SequenceDerivation;
import com.tmdbsync.ingestion.candidate.StoreKeyListing;
import com.tmdbsync.ingestion.projection.CompanyDetailsProjector;
import com.tmdbsync.ingestion.projection.EpisodeDetailsProjector;
import com.tmdbsync.ingestion.projection.MovieDetailsProjector;
import com.tmdbsync.ingestion.projection.NetworkDetailsProjector;
import com.tmdbsync.ingestion.projection.PersonDetailsProjector;
import com.tmdbsync.ingestion.projection.RecordProjector;
import com.tmdbsync.ingestion.projection.ReferenceRowProjectors;
import com.tmdbsync.ingestion.projection.ReviewsProjector;
import com.tmdbsync.ingestion.projection.SeasonDetailsProjector;
import com.tmdbsync.ingestion.projection.SeriesDetailsProjector;
import com.tmdbsync.ingestion.projection.SubresourceProjectors;
import com.tmdbsync.ingestion.projection.WatchProvidersProjector;
import com.tmdbsync.ingestion.refresh.FixedWindowRefreshPolicy;
import com.tmdbsync.ingestion.refresh.ParentDateRefreshPolicy;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;
import com.tmdbsync.ingestion.refresh.StatusWindowRefreshPolicy;
import com.tmdbsync.ingestion.refresh.StatusWindowRefreshPolicy.StatusRule;
import com.tmdbsync.ingestion.store.NdjsonCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The TMDB entities this service maintains, in dependency order: reference tables first (genres need the
 * languages), then movies with their sub-resources, people, companies and networks, then series with their
 * sub-resources, seasons (listed from series) and episodes (derived from seasons).
 */
public class TmdbEntityCatalog {

    public static final String REF_LANGUAGES = "ref_languages";
    public static final String REF_COUNTRIES = "ref_countries";
    public static final String REF_GENRE_MOVIES = "ref_genre_movies";
    public static final String REF_GENRE_SERIES = "ref_genre_series";
    public static final String CERTIFICATION_MOVIES = "certification_movies";
    public static final String CERTIFICATION_SERIES = "certification_series";
    public static final String MOVIE_DETAILS = "movie_details";
    public static final String MOVIE_ALTERNATIVE_TITLES = "movie_alternative_titles";
    public static final String MOVIE_CREDITS = "movie_credits";
    public static final String MOVIE_EXTERNAL_IDS = "movie_external_ids";
    public static final String MOVIE_KEYWORDS = "movie_keywords";
    public static final String MOVIE_RELEASE_DATES = "movie_release_dates";
    public static final String MOVIE_REVIEWS = "movie_reviews";
    public static final String MOVIE_TRANSLATIONS = "movie_translations";
    public static final String WATCH_PROVIDERS_MOVIES = "watch_providers_movies";
    public static final String PEOPLE_DETAILS = "people_details";
    public static final String COMPANY_DETAILS = "company_details";
    public static final String TV_NETWORKS_DETAILS = "tv_networks_details";
    public static final String TV_SERIES_DETAILS = "tv_series_details";
    public static final String TV_SERIES_ALTERNATIVE_TITLES = "tv_series_alternative_titles";
    public static final String TV_SERIES_CONTENT_RATINGS = "tv_series_content_ratings";
    public static final String TV_SERIES_EXTERNAL_IDS = "tv_series_external_ids";
    public static final String TV_SERIES_REVIEWS = "tv_series_reviews";
    public static final String TV_SERIES_TRANSLATIONS = "tv_series_translations";
    public static final String WATCH_PROVIDERS_SERIES = "watch_providers_series";
    public static final String TV_SEASONS_DETAILS = "tv_seasons_details";
    public static final String TV_EPISODES_DETAILS = "tv_episodes_details";

    static final String MOVIE_DUMPS = "movie_dumps.json";
    static final String PEOPLE_DUMPS = "people_dumps.json";
    static final String TV_SERIES_DUMPS = "tv_series_dumps.json";
    static final String COMPANY_DUMPS = "production_companies_dumps.json";
    static final String NETWORK_DUMPS = "tv_networks_dumps.json";

    private static final KeySchema BY_ID = KeySchema.of("id");
    private static final KeySchema SEASON_KEY = KeySchema.of("series_id", "season_number");
    private static final KeySchema EPISODE_KEY = KeySchema.of("series_id", "season_number", "episode_number");
    private static final KeySchema CERTIFICATION_KEY = KeySchema.of("country_code", "certification");

    private final Map<String, SyncEntity> entities = new LinkedHashMap<>();

    public TmdbEntityCatalog(Path dataDir, NdjsonCodec codec) {
        Path languagesStore = dataDir.resolve(store(REF_LANGUAGES));
        register(new RebuildDescriptor(REF_LANGUAGES, store(REF_LANGUAGES), KeySchema.of("iso_639_1"),
                () -> List.of(RebuildCall.of("/configuration/languages")), ReferenceRowProjectors.languages()));
        register(new RebuildDescriptor(REF_COUNTRIES, store(REF_COUNTRIES), KeySchema.of("iso_3166_1"),
                () -> List.of(RebuildCall.of("/configuration/countries")), ReferenceRowProjectors.countries()));
        register(new RebuildDescriptor(REF_GENRE_MOVIES, store(REF_GENRE_MOVIES), KeySchema.of("iso_639_1", "id"),
                new LanguageCodeCalls(codec, languagesStore, "/genre/movie/list"),
                ReferenceRowProjectors.movieGenres()));
        register(new RebuildDescriptor(REF_GENRE_SERIES, store(REF_GENRE_SERIES), KeySchema.of("iso_639_1", "id"),
                new LanguageCodeCalls(codec, languagesStore, "/genre/tv/list"),
                ReferenceRowProjectors.seriesGenres()));
        register(new RebuildDescriptor(CERTIFICATION_MOVIES, store(CERTIFICATION_MOVIES), CERTIFICATION_KEY,
                () -> List.of(RebuildCall.of("/certification/movie/list")), ReferenceRowProjectors.certifications()));
        register(new RebuildDescriptor(CERTIFICATION_SERIES, store(CERTIFICATION_SERIES), CERTIFICATION_KEY,
                () -> List.of(RebuildCall.of("/certification/tv/list")), ReferenceRowProjectors.certifications()));

        Path movieDumps = dataDir.resolve(MOVIE_DUMPS);
        register(new EntityDescriptor(MOVIE_DETAILS, store(MOVIE_DETAILS), BY_ID,
                new StoreKeyListing(codec, movieDumps, BY_ID),
                key -> "/movie/" + key.part(0), Map.of(),
                new MovieDetailsProjector(),
                new FixedWindowRefreshPolicy("release_date", 30)));
        registerSubresource(MOVIE_ALTERNATIVE_TITLES, codec, movieDumps, "/movie/", "/alternative_titles",
                SubresourceProjectors.movieAlternativeTitles());
        registerSubresource(MOVIE_CREDITS, codec, movieDumps, "/movie/", "/credits",
                SubresourceProjectors.movieCredits());
        registerSubresource(MOVIE_EXTERNAL_IDS, codec, movieDumps, "/movie/", "/external_ids",
                SubresourceProjectors.externalIds());
        registerSubresource(MOVIE_KEYWORDS, codec, movieDumps, "/movie/", "/keywords",
                SubresourceProjectors.movieKeywords());
        registerSubresource(MOVIE_RELEASE_DATES, codec, movieDumps, "/movie/", "/release_dates",
                SubresourceProjectors.movieReleaseDates());
        registerSubresource(MOVIE_REVIEWS, codec, movieDumps, "/movie/", "/reviews", new ReviewsProjector());
        registerSubresource(MOVIE_TRANSLATIONS, codec, movieDumps, "/movie/", "/translations",
                SubresourceProjectors.movieTranslations());
        registerWatchProviders(WATCH_PROVIDERS_MOVIES, codec, movieDumps, "/movie/", "id_movie");

        register(new EntityDescriptor(PEOPLE_DETAILS, store(PEOPLE_DETAILS), BY_ID,
                new StoreKeyListing(codec, dataDir.resolve(PEOPLE_DUMPS), BY_ID),
                key -> "/person/" + key.part(0), Map.of(),
                new PersonDetailsProjector(),
                RefreshPolicy.never()));
        register(new EntityDescriptor(COMPANY_DETAILS, store(COMPANY_DETAILS), BY_ID,
                new StoreKeyListing(codec, dataDir.resolve(COMPANY_DUMPS), BY_ID),
                key -> "/company/" + key.part(0), Map.of(),
                new CompanyDetailsProjector(),
                RefreshPolicy.never()));
        register(new EntityDescriptor(TV_NETWORKS_DETAILS, store(TV_NETWORKS_DETAILS), BY_ID,
                new StoreKeyListing(codec, dataDir.resolve(NETWORK_DUMPS), BY_ID),
                key -> "/network/" + key.part(0), Map.of(),
                new NetworkDetailsProjector(),
                RefreshPolicy.never()));

        Path seriesDumps = dataDir.resolve(TV_SERIES_DUMPS);
        register(new EntityDescriptor(TV_SERIES_DETAILS, store(TV_SERIES_DETAILS), BY_ID,
                new StoreKeyListing(codec, seriesDumps, BY_ID),
                key -> "/tv/" + key.part(0), Map.of(),
                new SeriesDetailsProjector(),
                seriesRefreshPolicy()));
        registerSubresource(TV_SERIES_ALTERNATIVE_TITLES, codec, seriesDumps, "/tv/", "/alternative_titles",
                SubresourceProjectors.seriesAlternativeTitles());
        registerSubresource(TV_SERIES_CONTENT_RATINGS, codec, seriesDumps, "/tv/", "/content_ratings",
                SubresourceProjectors.seriesContentRatings());
        registerSubresource(TV_SERIES_EXTERNAL_IDS, codec, seriesDumps, "/tv/", "/external_ids",
                SubresourceProjectors.externalIds());
        registerSubresource(TV_SERIES_REVIEWS, codec, seriesDumps, "/tv/", "/reviews", new ReviewsProjector());
        registerSubresource(TV_SERIES_TRANSLATIONS, codec, seriesDumps, "/tv/", "/translations",
                SubresourceProjectors.seriesTranslations());
        registerWatchProviders(WATCH_PROVIDERS_SERIES, codec, seriesDumps, "/tv/", "id_series");

        register(new EntityDescriptor(TV_SEASONS_DETAILS, store(TV_SEASONS_DETAILS), SEASON_KEY,
                new NestedKeyListing(codec, dataDir.resolve(store(TV_SERIES_DETAILS)), "id", "seasons_index",
                        "season_number"),
                key -> "/tv/" + key.part(0) + "/season/" + key.part(1), Map.of(),
                new SeasonDetailsProjector(),
                new FixedWindowRefreshPolicy("air_date", 60)));
        register(new EntityDescriptor(TV_EPISODES_DETAILS, store(TV_EPISODES_DETAILS), EPISODE_KEY,
                new SequenceDerivation(codec, dataDir.resolve(store(TV_SEASONS_DETAILS)), SEASON_KEY,
                        "episode_count", "air_date"),
                key -> "/tv/" + key.part(0) + "/season/" + key.part(1) + "/episode/" + key.part(2), Map.of(),
                new EpisodeDetailsProjector(),
                new ParentDateRefreshPolicy(60)));
    }

    /**
     * A per-title resource such as {@code /movie/{id}/credits}, one line per title. Its records carry no date, so
     * they are fetched once per title.
     */
    private void registerSubresource(String name, NdjsonCodec codec, Path dumps, String prefix, String suffix,
                                     RecordProjector projector) {
        register(new EntityDescriptor(name, store(name), BY_ID,
                new StoreKeyListing(codec, dumps, BY_ID),
                key -> prefix + key.part(0) + suffix, Map.of(),
                projector,
                RefreshPolicy.never()));
    }

    /**
     * {@code /movie/{id}/watch/providers} or {@code /tv/{id}/watch/providers}: one line per country and provider,
     * all sharing the title id stored under {@code ownerField}.
     */
    private void registerWatchProviders(String name, NdjsonCodec codec, Path dumps, String prefix, String ownerField) {
        register(new EntityDescriptor(name, store(name), KeySchema.of(ownerField),
                new StoreKeyListing(codec, dumps, BY_ID),
                key -> prefix + key.part(0) + "/watch/providers", Map.of(),
                new WatchProvidersProjector(ownerField),
                RefreshPolicy.never()));
    }

    /**
     * Series still airing are refreshed on every run; finished ones only while their last air date is recent.
     */
    static RefreshPolicy seriesRefreshPolicy() {
        Map<String, StatusRule> rules = new LinkedHashMap<>();
        rules.put("Returning Series", StatusRule.always());
        rules.put("In Production", StatusRule.window(30));
        rules.put("Pilot", StatusRule.window(90));
        rules.put("Planned", StatusRule.window(90));
        rules.put("Canceled", StatusRule.window(365));
        rules.put("Ended", StatusRule.window(180));
        return new StatusWindowRefreshPolicy("status", "last_air_date", rules, 60);
    }

    private static String store(String entity) {
        return entity + ".ndjson";
    }

    private void register(SyncEntity entity) {
        entities.put(entity.name(), entity);
    }

    public Collection<SyncEntity> all() {
        return Collections.unmodifiableCollection(entities.values());
    }

    public Optional<SyncEntity> find(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    /**
     * Entities named in {@code names}, in catalog order. An empty selection means the whole catalog.
     *
     * @throws IllegalArgumentException on an unknown name
     */
    public List<SyncEntity> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return new ArrayList<>(entities.values());
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String raw : names) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            if (!entities.containsKey(name)) {
                throw new IllegalArgumentException("Unknown entity '" + name + "'; known: " + entities.keySet());
            }
            wanted.add(name);
        }
        List<SyncEntity> out = new ArrayList<>();
        for (SyncEntity entity : entities.values()) {
            if (wanted.contains(entity.name())) {
                out.add(entity);
            }
        }
        return out;
    }
}
