package dev.aparikh.msgexplorer.dimension;

import dev.aparikh.msgexplorer.error.QueryValidationException;
import dev.aparikh.msgexplorer.filter.TextMatch;
import dev.aparikh.msgexplorer.model.Message;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of the dimensions a message corpus can be analysed along.
 */
@Component
public class DimensionRegistry {

    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();

    public DimensionRegistry() {
        register(new TemporalDimension("time", Message.FIELD_TIME, Message::time));
        register(CategoricalDimension.single("message_type", Message.FIELD_TYPE, Message::messageType,
                TextMatch.PREFIX, Map.of("tweet", "Tweet", "retweet", "Retweet", "reply", "Reply")));
        register(CategoricalDimension.single("sender_name", Message.FIELD_SENDER_NAME, Message::senderName,
                TextMatch.SUBSTRING, Map.of()));
        register(CategoricalDimension.single("language", Message.FIELD_LANGUAGE, Message::language,
                TextMatch.PREFIX, Map.of()));
        register(CategoricalDimension.single("sentiment", Message.FIELD_SENTIMENT, Message::sentiment,
                TextMatch.PREFIX, Map.of("-1", "Negative", "0", "Neutral", "1", "Positive")));
        register(CategoricalDimension.multi("hashtags", Message.FIELD_HASHTAGS, Message::hashtags, TextMatch.PREFIX));
        register(CategoricalDimension.multi("mentions", Message.FIELD_MENTIONS, Message::mentions, TextMatch.PREFIX));
        register(CategoricalDimension.multi("urls", Message.FIELD_URLS, Message::urls, TextMatch.SUBSTRING));
        register(CategoricalDimension.multi("words", Message.FIELD_WORDS, Message::words, TextMatch.PREFIX));
        register(new ContinuousDimension("retweet_count", Message.FIELD_RETWEET_COUNT, Message::retweetCount));
        register(new ContinuousDimension("favorite_count", Message.FIELD_FAVORITE_COUNT, Message::favoriteCount));
        register(new ContinuousDimension("sender_followers", Message.FIELD_SENDER_FOLLOWERS, Message::senderFollowers));
    }

    private void register(Dimension dimension) {
        dimensions.put(dimension.key(), dimension);
    }

    public Optional<Dimension> find(String key) {
        return Optional.ofNullable(key).map(dimensions::get);
    }

    /**
     * Resolves a dimension by key.
     *
     * @param path request field reported when the key is unknown
     */
    public Dimension resolve(String key, String path) {
        return find(key).orElseThrow(() ->
                new QueryValidationException(path, "Unknown dimension '" + key + "'"));
    }

    public Collection<Dimension> all() {
        return Collections.unmodifiableCollection(dimensions.values());
    }
}
