package xzy.webdav.listing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.webdav.config.DavConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Decides which directory entries are hidden from a listing, per client user agent.
 * <p>
 * Rules map a user agent regex to a file name regex. Rules sharing a user agent regex are
 * joined by alternation, and the rule under the empty user agent applies to every client: it
 * is joined into each other rule and used alone for clients no rule matches. All matching is
 * anchored at the start of the input and need not consume all of it.
 * <p>
 * The user agent to rule resolution is cached. The cache is the only state shared and
 * written by concurrent requests, so it sits behind a lock; file name matching runs outside it.
 */
public final class DirectoryEntryFilter {
    private static final Logger log = LoggerFactory.getLogger(DirectoryEntryFilter.class);

    static final String RULE_ASGI_WEBDAV = ".+\\.WebDAV$";
    static final String RULE_MACOS = "^\\.DS_Store$|^\\._";
    static final String RULE_WINDOWS = "^Thumbs\\.db$";
    static final String RULE_SYNOLOGY = "^#recycle$|^@eaDir$";

    /**
     * Built-in rules, keyed by user agent regex. The empty key applies to every client.
     */
    public static final Map<String, String> DEFAULT_RULES;

    static {
        Map<String, String> rules = new LinkedHashMap<>();
        rules.put("", RULE_ASGI_WEBDAV);
        rules.put("WebDAVFS", RULE_MACOS + "|" + RULE_SYNOLOGY);
        rules.put("Microsoft-WebDAV-MiniRedir", RULE_WINDOWS + "|" + RULE_SYNOLOGY);
        DEFAULT_RULES = Collections.unmodifiableMap(rules);
    }

    private record UserAgentRule(Pattern userAgent, Pattern fileName) {
    }

    private final boolean enabled;
    private final List<UserAgentRule> rules;
    private final Pattern fallbackRule;

    private final ReentrantLock cacheLock = new ReentrantLock();
    private final Map<String, Pattern> ruleByUserAgent = new HashMap<>();

    public DirectoryEntryFilter(DavConfig.HideFileInDir config) {
        this.enabled = config.enable();
        if (!enabled) {
            this.rules = List.of();
            this.fallbackRule = null;
            return;
        }

        Map<String, String> merged = new LinkedHashMap<>();
        if (config.enableDefaultRules()) {
            merged.putAll(DEFAULT_RULES);
        }
        config.userRules().forEach((ua, fileName) -> merged.merge(ua, fileName, DirectoryEntryFilter::mergeRules));

        String fallback = merged.remove("");
        List<UserAgentRule> compiled = new ArrayList<>();
        merged.forEach((ua, fileName) -> compiled.add(new UserAgentRule(
                Pattern.compile(ua),
                Pattern.compile(fallback == null ? fileName : mergeRules(fallback, fileName)))));
        this.rules = List.copyOf(compiled);
        this.fallbackRule = fallback == null ? null : Pattern.compile(fallback);
        log.debug("Directory filter: {} user agent rules, fallback {}", rules.size(), fallback);
    }

    static String mergeRules(String a, String b) {
        return a + "|" + b;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return the file name rule for a user agent, or null when no rule applies
     */
    public Pattern resolveRule(String userAgent) {
        String ua = userAgent == null ? "" : userAgent;
        cacheLock.lock();
        try {
            Pattern cached = ruleByUserAgent.get(ua);
            if (cached != null) {
                return cached;
            }
            Pattern rule = lookupRule(ua);
            if (rule != null) {
                ruleByUserAgent.put(ua, rule);
            }
            return rule;
        } finally {
            cacheLock.unlock();
        }
    }

    private Pattern lookupRule(String userAgent) {
        for (UserAgentRule rule : rules) {
            if (rule.userAgent().matcher(userAgent).lookingAt()) {
                return rule.fileName();
            }
        }
        return fallbackRule;
    }

    public boolean shouldHide(String userAgent, String fileName) {
        if (!enabled) {
            return false;
        }
        Pattern rule = resolveRule(userAgent);
        if (rule == null) {
            return false;
        }
        if (rule.matcher(fileName).lookingAt()) {
            log.debug("Rule:{}, File:{}, hide it", rule, fileName);
            return true;
        }
        log.debug("Rule:{}, File:{}, show it", rule, fileName);
        return false;
    }

    int cachedUserAgents() {
        cacheLock.lock();
        try {
            return ruleByUserAgent.size();
        } finally {
            cacheLock.unlock();
        }
    }
}
