package org.royalewatch.service;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.royalewatch.model.PlayerProfile;
import org.royalewatch.model.Subject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client for the Clash Royale public API.
 */
public class ClashRoyaleService implements BattleLogSource, PlayerDirectory {
    private static final Logger log = LoggerFactory.getLogger(ClashRoyaleService.class);

    public static final String DEFAULT_BASE_URL = "https://api.clashroyale.com/v1";

    private final OkHttpClient client;
    private final HttpUrl baseUrl;

    public ClashRoyaleService(String apiKey, String baseUrl, Duration timeout) {
        this.baseUrl = HttpUrl.get(baseUrl);
        this.client = new OkHttpClient.Builder()
                .callTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .addInterceptor(chain -> {
                    Request request = chain.request().newBuilder()
                            .header("Authorization", "Bearer " + apiKey.trim())
                            .header("Accept", "application/json")
                            .build();
                    return chain.proceed(request);
                })
                .build();
    }

    public ClashRoyaleService(String apiKey) {
        this(apiKey, DEFAULT_BASE_URL, Duration.ofSeconds(20));
    }

    // --- PLAYER ---
    @Override
    public PlayerProfile fetchProfile(String tag) throws ApiException {
        JSONObject json = fetchPlayer(tag);
        JSONObject arena = json.optJSONObject("arena");
        return new PlayerProfile(
                profileTag(json.optString("tag", ""), tag),
                json.optString("name", tag),
                arena != null ? arena.optString("name", null) : null,
                json.optInt("trophies", 0)
        );
    }

    @Override
    public JSONObject fetchPlayer(String tag) throws ApiException {
        return readObject(execute(tagUrl("players", tag).build(), "Player " + tag), "profile for " + tag);
    }

    // --- CLAN ---
    @Override
    public JSONObject fetchClan(String clanTag) throws ApiException {
        return readObject(execute(tagUrl("clans", clanTag).build(), "Clan " + clanTag), "clan " + clanTag);
    }

    // --- CHESTS ---
    @Override
    public List<JSONObject> fetchUpcomingChests(String tag) throws ApiException {
        HttpUrl url = tagUrl("players", tag).addPathSegment("upcomingchests").build();
        JSONArray items = readObject(execute(url, "Player " + tag), "chests for " + tag).optJSONArray("items");
        return items != null ? objects(items) : List.of();
    }

    // --- BATTLE LOG ---
    @Override
    public List<JSONObject> fetchBattleLog(String tag) throws ApiException {
        HttpUrl url = tagUrl("players", tag).addPathSegment("battlelog").build();
        JSONArray array;
        try {
            array = new JSONArray(execute(url, "Player " + tag));
        } catch (JSONException e) {
            throw new ApiException(ApiException.Kind.TRANSIENT, "Unreadable battle log for " + tag, null, e);
        }
        return objects(array);
    }

    // --- UTILS ---
    private HttpUrl.Builder tagUrl(String collection, String tag) throws ApiException {
        String normalized;
        try {
            normalized = Subject.normalizeTag(tag);
        } catch (IllegalArgumentException e) {
            throw new ApiException(ApiException.Kind.NOT_FOUND, "Invalid tag " + tag, null, e);
        }
        // addPathSegment encodes the leading '#' as %23
        return baseUrl.newBuilder()
                .addPathSegment(collection)
                .addPathSegment(Subject.displayTag(normalized));
    }

    /** The tag echoed by the API, or the requested one when the echo is missing or malformed. */
    static String profileTag(String echoed, String requested) {
        try {
            return Subject.normalizeTag(echoed);
        } catch (IllegalArgumentException e) {
            log.warn("[ClashRoyale] Profile for {} carried unusable tag '{}'", requested, echoed);
            return Subject.normalizeTag(requested);
        }
    }

    private static JSONObject readObject(String body, String what) throws ApiException {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new ApiException(ApiException.Kind.TRANSIENT, "Unreadable " + what, null, e);
        }
    }

    private static List<JSONObject> objects(JSONArray array) {
        List<JSONObject> result = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject entry = array.optJSONObject(i);
            if (entry != null) result.add(entry);
        }
        return result;
    }

    private String execute(HttpUrl url, String what) throws ApiException {
        Request request = new Request.Builder().url(url).build();
        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            switch (response.code()) {
                case 200:
                    return body;
                case 404:
                    throw new ApiException(ApiException.Kind.NOT_FOUND, what + " not found");
                case 429:
                    throw new ApiException(ApiException.Kind.RATE_LIMITED, "Rate limited while fetching " + what,
                            parseRetryAfter(response.header("Retry-After")), null);
                case 403:
                    log.error("[ClashRoyale] API key rejected or IP not whitelisted: {}", body);
                    throw new ApiException(ApiException.Kind.TRANSIENT, "API key invalid or IP not whitelisted");
                default:
                    throw new ApiException(ApiException.Kind.TRANSIENT, "HTTP " + response.code() + " for " + what);
            }
        } catch (IOException e) {
            throw new ApiException(ApiException.Kind.TRANSIENT, "I/O error fetching " + what + ": " + e.getMessage(), null, e);
        }
    }

    static Duration parseRetryAfter(String header) {
        if (header == null) return null;
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
