package xzy.webdav.response;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Codings a client accepts, from its {@code Accept-Encoding} header. A coding listed with
 * {@code q=0} is refused; {@code *} stands for every coding not listed explicitly.
 */
public record AcceptEncoding(Set<String> accepted, Set<String> refused, boolean wildcard) {

    public static final AcceptEncoding NONE = new AcceptEncoding(Set.of(), Set.of(), false);

    public AcceptEncoding {
        accepted = Set.copyOf(accepted);
        refused = Set.copyOf(refused);
    }

    public static AcceptEncoding parse(String header) {
        if (header == null || header.isBlank()) {
            return NONE;
        }
        Set<String> accepted = new TreeSet<>();
        Set<String> refused = new TreeSet<>();
        boolean wildcard = false;
        for (String part : header.split(",")) {
            String[] params = part.split(";");
            String coding = params[0].trim().toLowerCase(Locale.ROOT);
            if (coding.isEmpty()) {
                continue;
            }
            boolean zero = false;
            for (int i = 1; i < params.length; i++) {
                String param = params[i].trim();
                if (param.startsWith("q=") || param.startsWith("Q=")) {
                    zero = isZero(param.substring(2).trim());
                }
            }
            if (coding.equals("*")) {
                wildcard = !zero;
            } else if (zero) {
                refused.add(coding);
            } else {
                accepted.add(coding);
            }
        }
        return new AcceptEncoding(accepted, refused, wildcard);
    }

    public boolean accepts(String coding) {
        if (refused.contains(coding)) {
            return false;
        }
        return accepted.contains(coding) || wildcard;
    }

    public boolean gzip() {
        return accepts("gzip");
    }

    public boolean brotli() {
        return accepts("br");
    }

    private static boolean isZero(String q) {
        try {
            return Double.parseDouble(q) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
