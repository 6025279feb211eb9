package dev.aparikh.msgexplorer.model;

import java.time.Instant;
import java.util.List;

/**
 * Corpus message as stored in Solr by the enrichment pipeline.
 */
public record Message(
        String id,
        long datasetId,
        Instant time,
        String messageType,
        String senderId,
        String senderName,
        String language,
        String sentiment,
        String text,
        List<String> hashtags,
        List<String> mentions,
        List<String> urls,
        List<String> words,
        Long retweetCount,
        Long favoriteCount,
        Long senderFollowers
) {
    // Solr field names - centralized constants for use across the application
    public static final String FIELD_ID = "id";
    public static final String FIELD_DATASET = "dataset_id";
    public static final String FIELD_TIME = "time";
    public static final String FIELD_TYPE = "message_type";
    public static final String FIELD_SENDER_ID = "sender_id";
    public static final String FIELD_SENDER_NAME = "sender_name";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_SENTIMENT = "sentiment";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_HASHTAGS = "hashtags";
    public static final String FIELD_MENTIONS = "mentions";
    public static final String FIELD_URLS = "urls";
    public static final String FIELD_WORDS = "words";
    public static final String FIELD_RETWEET_COUNT = "retweet_count";
    public static final String FIELD_FAVORITE_COUNT = "favorite_count";
    public static final String FIELD_SENDER_FOLLOWERS = "sender_followers";

    public Message {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
        urls = urls == null ? List.of() : List.copyOf(urls);
        words = words == null ? List.of() : List.copyOf(words);
    }
}
