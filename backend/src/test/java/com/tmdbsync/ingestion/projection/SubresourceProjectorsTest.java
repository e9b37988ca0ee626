package com.tmdbsync.ingestion.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.domain.IdentityKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubresourceProjectorsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void movieCredits_keepRolesAndOrderOnly() throws Exception {
        ObjectNode out = SubresourceProjectors.movieCredits().project(json("""
                {"id":550,"cast":[{"credit_id":"c1","id":819,"character":"Narrator","order":0,"profile_path":"/n.jpg"}],
                 "crew":[{"credit_id":"c2","id":7467,"department":"Directing","job":"Director","popularity":3.2}]}
                """), IdentityKey.of(550));

        assertThat(out.get("cast").toString())
                .isEqualTo("[{\"credit_id\":\"c1\",\"id\":819,\"character\":\"Narrator\",\"order\":0}]");
        assertThat(out.get("crew").get(0).has("popularity")).isFalse();
    }

    @Test
    void movieReleaseDates_flattenCountryGroups() throws Exception {
        ObjectNode out = SubresourceProjectors.movieReleaseDates().project(json("""
                {"id":550,"results":[
                  {"iso_3166_1":"US","release_dates":[
                    {"certification":"R","release_date":"1999-10-15T00:00:00.000Z","type":3,"note":""},
                    {"certification":"","release_date":"2000-04-25T00:00:00.000Z","type":5}]},
                  {"iso_3166_1":"FR","release_dates":[{"certification":"16","release_date":"1999-11-10T00:00:00.000Z","type":3}]}]}
                """), IdentityKey.of(550));

        JsonNode flattened = out.get("release_dates");
        assertThat(flattened).hasSize(3);
        assertThat(flattened.get(0).toString()).isEqualTo(
                "{\"iso_3166_1\":\"US\",\"release_date\":\"1999-10-15T00:00:00.000Z\",\"type\":3,\"certification\":\"R\"}");
        assertThat(flattened.get(2).get("iso_3166_1").asText()).isEqualTo("FR");
    }

    @Test
    void translations_liftFieldsOutOfData() throws Exception {
        ObjectNode movie = SubresourceProjectors.movieTranslations().project(json("""
                {"id":550,"translations":[{"iso_639_1":"fr","iso_3166_1":"FR","english_name":"French",
                  "data":{"title":"Fight Club","overview":"Un homme...","tagline":"","homepage":"h","runtime":139}}]}
                """), IdentityKey.of(550));
        ObjectNode series = SubresourceProjectors.seriesTranslations().project(json("""
                {"id":1399,"translations":[{"iso_639_1":"fr","iso_3166_1":"FR",
                  "data":{"name":"Le Trône de fer","overview":"...","tagline":null}}]}
                """), IdentityKey.of(1399));

        assertThat(movie.get("translations").get(0).toString()).isEqualTo(
                "{\"iso_639_1\":\"fr\",\"iso_3166_1\":\"FR\",\"title\":\"Fight Club\",\"overview\":\"Un homme...\",\"tagline\":\"\"}");
        assertThat(series.get("translations").get(0).get("name").asText()).isEqualTo("Le Trône de fer");
        assertThat(series.get("translations").get(0).get("tagline").isNull()).isTrue();
    }

    @Test
    void seriesLists_areRenamedFromResults() throws Exception {
        JsonNode payload = json("""
                {"id":1399,"results":[{"iso_3166_1":"US","title":"GoT","rating":"TV-MA","type":""}]}
                """);

        ObjectNode titles = SubresourceProjectors.seriesAlternativeTitles().project(payload, IdentityKey.of(1399));
        ObjectNode ratings = SubresourceProjectors.seriesContentRatings().project(payload, IdentityKey.of(1399));

        assertThat(titles.get("alternative_titles").toString()).isEqualTo("[{\"iso_3166_1\":\"US\",\"title\":\"GoT\"}]");
        assertThat(ratings.get("content_ratings").toString()).isEqualTo("[{\"iso_3166_1\":\"US\",\"rating\":\"TV-MA\"}]");
    }

    @Test
    void externalIds_keepImdbOnly() throws Exception {
        ObjectNode out = SubresourceProjectors.externalIds().project(json("""
                {"id":550,"imdb_id":"tt0137523","facebook_id":"FightClub","wikidata_id":"Q190050"}
                """), IdentityKey.of(550));

        assertThat(out.toString()).isEqualTo("{\"id\":550,\"imdb_id\":\"tt0137523\"}");
    }

    @Test
    void company_parentIsAlwaysAnObject() throws Exception {
        ObjectNode independent = new CompanyDetailsProjector().project(json("""
                {"id":1,"name":"Lucasfilm","description":"","headquarters":"San Francisco","homepage":"h",
                 "origin_country":"US","parent_company":null}
                """), IdentityKey.of(1));
        ObjectNode owned = new CompanyDetailsProjector().project(json("""
                {"id":2,"name":"Pixar","parent_company":{"id":2,"name":"Walt Disney Pictures","logo_path":"/w.png"}}
                """), IdentityKey.of(2));

        assertThat(independent.get("parent_company").toString()).isEqualTo("{\"id\":null,\"name\":null}");
        assertThat(independent.has("homepage")).isFalse();
        assertThat(owned.get("parent_company").toString()).isEqualTo("{\"id\":2,\"name\":\"Walt Disney Pictures\"}");
    }

    @Test
    void watchProviders_deduplicateAcrossOfferTypes() throws Exception {
        List<ObjectNode> rows = new WatchProvidersProjector("id_series").project(json("""
                {"id":1399,"results":{
                  "US":{"link":"l","flatrate":[{"provider_id":1899,"provider_name":"Max","logo_path":"/m.png"}],
                        "buy":[{"provider_id":1899,"provider_name":"Max"},{"provider_id":"bad","provider_name":"x"}]},
                  "FR":{"ads":[{"provider_id":35,"provider_name":"Rakuten TV"}]}}}
                """), IdentityKey.of(1399));

        assertThat(rows).extracting(ObjectNode::toString).containsExactly(
                "{\"id_series\":1399,\"provider_id\":1899,\"provider_name\":\"Max\",\"country_code\":\"US\"}",
                "{\"id_series\":1399,\"provider_id\":35,\"provider_name\":\"Rakuten TV\",\"country_code\":\"FR\"}");
    }

    @Test
    void watchProviders_noResultsMeansNoRows() throws Exception {
        assertThat(new WatchProvidersProjector("id_movie").project(json("{\"id\":1,\"results\":{}}"),
                IdentityKey.of(1))).isEmpty();
        assertThat(new WatchProvidersProjector("id_movie").project(json("[]"), IdentityKey.of(1))).isEmpty();
    }
}
