package feed.relay.action;

import cn.hutool.core.util.StrUtil;
import org.jooq.lambda.tuple.Tuple;
import org.jooq.lambda.tuple.Tuple2;

import java.util.Optional;

public class CallbackData {

    private static final String SEPARATOR = "|";

    /**
     * Decode {@code <prefix>|<token>}, e.g. {@code hd_url|hd_k3x9q2} or {@code video_urls|7301234567}.
     */
    public static Optional<Tuple2<ActionKind, String>> parse(String data) {
        if (StrUtil.isBlank(data) || !data.contains(SEPARATOR)) {
            return Optional.empty();
        }
        String prefix = StrUtil.subBefore(data, SEPARATOR, false);
        String token = StrUtil.subAfter(data, SEPARATOR, false);
        if (StrUtil.isBlank(token)) {
            return Optional.empty();
        }
        return ActionKind.fromCallbackPrefix(prefix).map(kind -> Tuple.tuple(kind, token));
    }

    public static String encode(ActionKind kind, String token) {
        return kind.callbackPrefix() + SEPARATOR + token;
    }
}
