package com.projectgroup5.dogfight.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 游客身份：不存储任何凭据
 * 每次 join 发一个随机的重连令牌（只发给本人，不进快照），令牌 -> 玩家 id 只保存在内存里。
 * 令牌一次有效，重连成功后换发新的。
 */
@Component
public class GuestIdentityProvider implements IdentityProvider {
    private static final Logger logger = LoggerFactory.getLogger(GuestIdentityProvider.class);

    static final int MAX_NAME_LENGTH = 24;
    static final int MAX_TOKENS = 10_000;
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[\\p{Cntrl}<>\"'&]");

    // 重连令牌 -> 玩家 id，超过上限时淘汰最早的
    private final Map<String, String> reconnectTokens = Collections.synchronizedMap(
            new LinkedHashMap<String, String>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_TOKENS;
                }
            });

    @Override
    public PlayerIdentity resolve(String requestedName, String token) {
        String id = token == null ? null : reconnectTokens.remove(token);
        if (id == null) {
            id = "pl-" + randomHex();
        } else {
            logger.info("Guest {} presented a valid reconnect token", id);
        }
        String secret = "rt-" + randomHex() + randomHex();
        reconnectTokens.put(secret, id);

        String name = sanitize(requestedName);
        if (name.isEmpty()) {
            name = "Pilot-" + id.substring(3, 7);
        }
        logger.debug("Resolved guest identity {} for name '{}'", id, name);
        return new PlayerIdentity(id, name, secret);
    }

    int getTokenCount() {
        return reconnectTokens.size();
    }

    private static String randomHex() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    static String sanitize(String requestedName) {
        if (requestedName == null) {
            return "";
        }
        String cleaned = UNSAFE_CHARS.matcher(requestedName).replaceAll("").trim();
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH).trim();
        }
        return cleaned;
    }
}
