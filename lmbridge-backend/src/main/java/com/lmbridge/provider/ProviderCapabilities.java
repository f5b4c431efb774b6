package com.lmbridge.provider;

import com.lmbridge.api.ProviderCapability;
import com.lmbridge.api.ProviderCapability.Auth;
import com.lmbridge.api.ProviderCapability.Endpoints;
import com.lmbridge.api.ProviderCapability.RateLimit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Catalogue of the metadata providers the bridge knows about.
 */
@Component
public class ProviderCapabilities {

    private static final String ARTIST_IMAGES = "artist_images";

    private final List<ProviderCapability> catalogue;

    public ProviderCapabilities() {
        List<ProviderCapability> list = new ArrayList<>();
        list.add(ProviderCapability.builder()
                .id("musicbrainz")
                .displayName("MusicBrainz")
                .capabilities(List.of("artist_metadata", "artist_links", "discography", "album_metadata",
                        "album_art", "series", "id_redirects", "spotify_mapping"))
                .auth(auth("none"))
                .endpoints(endpoints("musicbrainz_db"))
                .rateLimit(RateLimit.builder().notes("DB-backed").build())
                .supportsCache(true)
                .pricing("unknown")
                .notes("Cover art via CAA URLs; links parsed into typed sources.")
                .build());
        list.add(artistImages("fanart", "Fanart.tv", auth("api_key", "FANART_KEY"),
                "https://webservice.fanart.tv/v3.2/music", "free",
                "Artist artwork only (clearlogo, banner, fanart, poster)."));
        list.add(artistImages("theaudiodb", "TheAudioDB", auth("api_key", "TADB_KEY"),
                "https://www.theaudiodb.com/api/v2/json", "paid_required",
                "Artist artwork only (v2 premium API)."));
        list.add(artistImages("discogs", "Discogs", auth("token", "DISCOGS_KEY"),
                "https://api.discogs.com", "free",
                "Artist imagery and related metadata."));
        list.add(artistImages("tidal", "TIDAL",
                Auth.builder()
                        .type("oauth_client")
                        .fields(List.of("TIDAL_CLIENT_ID", "TIDAL_CLIENT_SECRET", "TIDAL_COUNTRY_CODE"))
                        .optionalFields(List.of("TIDAL_USER", "TIDAL_USER_PASSWORD"))
                        .build(),
                "https://openapi.tidal.com/v2", "paid_required",
                "Profile art via official API; user creds used for lookup fallback."));
        list.add(artistImages("apple_music", "Apple Music", auth("none"),
                "https://itunes.apple.com/search", "free",
                "Artist artwork via iTunes Search API."));
        list.add(ProviderCapability.builder()
                .id("lastfm")
                .displayName("Last.fm")
                .capabilities(List.of("charts"))
                .auth(auth("api_key", "LASTFM_KEY", "LASTFM_SECRET"))
                .endpoints(endpoints("https://ws.audioscrobbler.com/2.0/"))
                .rateLimit(RateLimit.builder().notes("Best effort").build())
                .supportsCache(true)
                .pricing("free")
                .notes("Top artists/albums only.")
                .build());
        list.sort(Comparator.comparing(ProviderCapability::getId));
        this.catalogue = List.copyOf(list);
    }

    /**
     * @return capabilities sorted by provider id
     */
    public List<ProviderCapability> list() {
        return catalogue;
    }

    private static ProviderCapability artistImages(String id, String name, Auth auth, String baseUrl, String pricing, String notes) {
        return ProviderCapability.builder()
                .id(id)
                .displayName(name)
                .capabilities(List.of(ARTIST_IMAGES))
                .auth(auth)
                .endpoints(endpoints(baseUrl))
                .rateLimit(RateLimit.builder().notes("Best effort").build())
                .supportsCache(true)
                .pricing(pricing)
                .notes(notes)
                .build();
    }

    private static Auth auth(String type, String... fields) {
        return Auth.builder().type(type).fields(List.of(fields)).build();
    }

    private static Endpoints endpoints(String baseUrl) {
        return Endpoints.builder().baseUrl(baseUrl).docsUrl("").build();
    }
}
