package com.mudhub.realtime.bus;

import com.mudhub.realtime.routing.ChannelKind;

import java.util.Optional;

/**
 * 统一管理 Broker 主题的拼接与解析，避免字符串散落。
 *
 * 主题格式：
 * - {root}.location.{locationKey}
 * - {root}.global
 * - {root}.direct.{identity}
 * - {root}.system
 *
 * 参数段不允许包含空白、'.'、'*'、'>'；整个主题不超过 255 个字符。
 */
public final class SubjectNames {

    public static final int MAX_SUBJECT_LENGTH = 255;

    private static final String LOCATION = "location";
    private static final String GLOBAL = "global";
    private static final String DIRECT = "direct";
    private static final String SYSTEM = "system";

    private final String root;

    public SubjectNames(String root) {
        this.root = validateToken(root, "root");
    }

    public String root() {
        return root;
    }

    // ---- 位置频道 ----
    public String location(String locationKey) {
        return checkLength(root + "." + LOCATION + "." + validateToken(locationKey, "locationKey"));
    }

    // ---- 全服频道 ----
    public String global() {
        return root + "." + GLOBAL;
    }

    // ---- 私聊：按收件人建主题 ----
    public String direct(String identity) {
        return checkLength(root + "." + DIRECT + "." + validateToken(identity, "identity"));
    }

    public String system() {
        return root + "." + SYSTEM;
    }

    /** 频道 + 参数 → 主题；位置/私聊参数为空时返回 empty */
    public Optional<String> forChannel(ChannelKind kind, String param) {
        return switch (kind) {
            case LOCATION -> param == null ? Optional.empty() : Optional.of(location(param));
            case DIRECT -> param == null ? Optional.empty() : Optional.of(direct(param));
            case BROADCAST -> Optional.of(global());
            case SYSTEM -> Optional.of(system());
        };
    }

    /**
     * 解析主题。不属于本前缀或格式不对时返回 empty。
     */
    public Optional<ParsedSubject> parse(String subject) {
        if (subject == null || !subject.startsWith(root + ".")) {
            return Optional.empty();
        }
        String rest = subject.substring(root.length() + 1);
        if (rest.equals(GLOBAL)) {
            return Optional.of(new ParsedSubject(ChannelKind.BROADCAST, null));
        }
        if (rest.equals(SYSTEM)) {
            return Optional.of(new ParsedSubject(ChannelKind.SYSTEM, null));
        }
        int dot = rest.indexOf('.');
        if (dot <= 0 || dot == rest.length() - 1) {
            return Optional.empty();
        }
        String head = rest.substring(0, dot);
        String param = rest.substring(dot + 1);
        if (!isValidToken(param)) {
            return Optional.empty();
        }
        return switch (head) {
            case LOCATION -> Optional.of(new ParsedSubject(ChannelKind.LOCATION, param));
            case DIRECT -> Optional.of(new ParsedSubject(ChannelKind.DIRECT, param));
            default -> Optional.empty();
        };
    }

    public boolean isValidToken(String token) {
        if (token == null || token.isEmpty() || token.length() > MAX_SUBJECT_LENGTH) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isWhitespace(c) || c == '.' || c == '*' || c == '>') {
                return false;
            }
        }
        return true;
    }

    private String validateToken(String token, String name) {
        if (!isValidToken(token)) {
            throw new IllegalArgumentException("invalid subject token " + name + ": '" + token + "'");
        }
        return token;
    }

    private static String checkLength(String subject) {
        if (subject.length() > MAX_SUBJECT_LENGTH) {
            throw new IllegalArgumentException("subject exceeds " + MAX_SUBJECT_LENGTH + " characters");
        }
        return subject;
    }

    /**
     * 解析后的主题：频道 + 参数（位置 key 或私聊收件人）。
     */
    public record ParsedSubject(ChannelKind kind, String param) {
    }
}
