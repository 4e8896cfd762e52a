package com.example.offlinecache.partition;

import com.example.offlinecache.core.NetRequest;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A url pattern, tested against the request path first and then the absolute url
 * (so rules for third-party hosts such as font CDNs match too).
 */
public final class MatchRule {

    private static final Set<String> DEFAULT_METHODS = Set.of("GET", "HEAD");

    private final Pattern pattern;
    private final Set<String> methods;

    public MatchRule(Pattern pattern, Set<String> methods) {
        this.pattern = pattern;
        this.methods = methods == null || methods.isEmpty()
            ? DEFAULT_METHODS
            : methods.stream().map(m -> m.toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public static MatchRule regex(String regex) {
        return new MatchRule(Pattern.compile(regex), null);
    }

    public boolean matches(NetRequest request) {
        if (!methods.contains(request.getMethod())) {
            return false;
        }
        return pattern.matcher(request.path()).find() || pattern.matcher(request.getUrl()).find();
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Set<String> getMethods() {
        return methods;
    }

    @Override
    public String toString() {
        return methods + " " + pattern.pattern();
    }
}
