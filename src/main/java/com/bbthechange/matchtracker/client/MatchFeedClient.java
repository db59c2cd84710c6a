package com.bbthechange.matchtracker.client;

import com.bbthechange.matchtracker.config.TrackerProperties;
import com.bbthechange.matchtracker.dto.feed.FeedMapResponse;
import com.bbthechange.matchtracker.dto.feed.FeedMatchResponse;
import com.bbthechange.matchtracker.dto.feed.FeedResultResponse;
import com.bbthechange.matchtracker.exception.MatchFeedException;
import com.bbthechange.matchtracker.model.MapDetail;
import com.bbthechange.matchtracker.model.MapScore;
import com.bbthechange.matchtracker.model.Match;
import com.bbthechange.matchtracker.model.MatchResult;
import com.bbthechange.matchtracker.util.TrackerDateParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for the match feed service, which serves already-scraped event pages as JSON.
 * Each call is a single attempt with its own timeout; retries belong to RetryableFetcher.
 */
@Component
public class MatchFeedClient implements MatchDataSource {

    private static final Logger logger = LoggerFactory.getLogger(MatchFeedClient.class);

    private static final String USER_AGENT = "MatchTracker/1.0";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public MatchFeedClient(
            ObjectMapper objectMapper,
            TrackerProperties properties,
            Clock clock,
            @Value("${tracker.feed.base-url}") String baseUrl,
            @Value("${tracker.feed.timeout:30s}") Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                objectMapper, ZoneId.of(properties.getTimezone()), clock, baseUrl, requestTimeout);
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    MatchFeedClient(HttpClient httpClient, ObjectMapper objectMapper, ZoneId zone, Clock clock,
                    String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.zone = zone;
        this.clock = clock;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public List<Match> fetchMatches(String eventId) {
        String body = get("/events/" + encode(eventId) + "/matches", eventId);
        List<FeedMatchResponse> raw = parse(body, new TypeReference<List<FeedMatchResponse>>() {}, eventId);

        Instant now = clock.instant();
        List<Match> matches = new ArrayList<>();
        for (FeedMatchResponse item : raw) {
            if (item == null || item.getId() == null) {
                continue;
            }
            matches.add(toMatch(item, now));
        }
        logger.debug("Fetched {} matches for event {}", matches.size(), eventId);
        return matches;
    }

    @Override
    public List<MatchResult> fetchResults(String eventId) {
        String body = get("/events/" + encode(eventId) + "/results", eventId);
        List<FeedResultResponse> raw = parse(body, new TypeReference<List<FeedResultResponse>>() {}, eventId);

        List<MatchResult> results = new ArrayList<>();
        for (FeedResultResponse item : raw) {
            if (item == null || item.getId() == null) {
                continue;
            }
            results.add(toResult(item));
        }
        logger.debug("Fetched {} results for event {}", results.size(), eventId);
        return results;
    }

    Match toMatch(FeedMatchResponse item, Instant now) {
        boolean live = Boolean.TRUE.equals(item.getLive()) || "LIVE".equalsIgnoreCase(item.getTime());
        Instant scheduled = null;
        if (item.getUnixTime() != null) {
            scheduled = Instant.ofEpochMilli(item.getUnixTime());
        } else if (!live) {
            scheduled = TrackerDateParser.parseMatchTime(item.getDate(), item.getTime(), zone, now);
        }

        return Match.builder()
                .id(item.getId())
                .teamA(item.getTeamA())
                .teamB(item.getTeamB())
                .live(live)
                .scheduledTime(scheduled)
                .mapsFormat(item.getFormat())
                .tbd(Boolean.TRUE.equals(item.getTbd()))
                .build();
    }

    MatchResult toResult(FeedResultResponse item) {
        List<MapScore> scores = new ArrayList<>();
        List<MapDetail> details = new ArrayList<>();
        if (item.getMaps() != null) {
            for (FeedMapResponse map : item.getMaps()) {
                if (map == null || map.getName() == null) {
                    continue;
                }
                scores.add(new MapScore(map.getName(), map.getScoreA(), map.getScoreB()));
                if (map.getStatsId() != null && !map.getStatsId().isBlank()) {
                    details.add(new MapDetail(map.getName(), map.getStatsId()));
                }
            }
        }

        return MatchResult.builder()
                .id(item.getId())
                .teamA(item.getTeamA())
                .teamB(item.getTeamB())
                .scoreA(Objects.requireNonNullElse(item.getScoreA(), 0))
                .scoreB(Objects.requireNonNullElse(item.getScoreB(), 0))
                .mapScores(scores)
                .mapDetails(details)
                .build();
    }

    private String get(String path, String eventId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw MatchFeedException.networkError(eventId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw MatchFeedException.networkError(eventId, e);
        }

        int statusCode = response.statusCode();
        logger.debug("Match feed response status: {} for {}", statusCode, path);

        if (statusCode == 429) {
            throw MatchFeedException.rateLimited(eventId);
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw MatchFeedException.httpError(eventId, statusCode);
        }
        return response.body();
    }

    private <T> List<T> parse(String body, TypeReference<List<T>> type, String eventId) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            List<T> parsed = objectMapper.readValue(body, type);
            return parsed == null ? List.of() : parsed;
        } catch (JsonProcessingException e) {
            throw MatchFeedException.parseError(eventId, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
