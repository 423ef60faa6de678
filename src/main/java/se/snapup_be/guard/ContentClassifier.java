package se.snapup_be.guard;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies chat text into ALLOW, WARN or BLOCK. Contact details and links are blocked
 * outright; scam phrasing and shouting are flagged as warnings. First match wins.
 */
@Component
public class ContentClassifier {

    private static final String DIGIT_WORD = "(?:zero|one|two|three|four|five|six|seven|eight|nine)";

    private static final List<Pattern> PHONE_PATTERNS = List.of(
            // SA numbers: 0XX XXX XXXX, +27XX XXX XXXX, 27XXXXXXXXX
            Pattern.compile("(?:\\+?27|0)\\s*[6-8]\\d[\\s.-]?\\d{3}[\\s.-]?\\d{4}"),
            Pattern.compile("\\b\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d[\\s.-]?\\d\\b"),
            Pattern.compile("\\b" + DIGIT_WORD + "[\\s,]+" + DIGIT_WORD + "[\\s,]+" + DIGIT_WORD, Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> EMAIL_PATTERNS = List.of(
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"),
            // "name at domain dot com"
            Pattern.compile("\\b\\w+\\s*(?:@|at)\\s*\\w+\\s*(?:\\.|dot)\\s*(?:com|co\\.za|net|org|gmail|yahoo|hotmail|outlook)\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> URL_PATTERNS = List.of(
            Pattern.compile("https?://[^\\s<>]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("www\\.[^\\s<>]+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\w+\\.(?:com|co\\.za|net|org|io|app|me|za|africa)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:bit\\.ly|tinyurl|goo\\.gl|t\\.co|is\\.gd|buff\\.ly|ow\\.ly|rebrand\\.ly)/\\w+", Pattern.CASE_INSENSITIVE)
    );

    static final List<String> SCAM_PHRASES = List.of(
            "send money to", "transfer money", "whatsapp me", "whatsapp number", "call me on",
            "text me on", "sms me", "pay me directly", "pay directly", "outside the app",
            "off the platform", "off platform", "western union", "money gram", "moneygram",
            "bitcoin", "crypto wallet", "gift card", "gift voucher", "send gift",
            "bank transfer direct", "eft me", "eft directly", "pay into my account", "my bank details",
            "account number is", "branch code is", "deposit into", "send to my", "wire transfer",
            "cashapp", "cash app", "venmo", "zelle", "telegram me", "signal me", "dm me on",
            "inbox me on", "contact me outside", "meet me alone", "come alone", "dont tell anyone",
            "don't tell anyone", "keep this between us", "advance payment", "advance fee",
            "pay upfront", "pay before", "nigerian prince", "congratulations you won", "you have won",
            "claim your prize", "lottery winner", "inheritance fund"
    );

    private static final Pattern REPEATED_CHARS = Pattern.compile("(.)\\1{5,}");
    private static final Pattern SPECIAL_CLUSTER = Pattern.compile("[!?$#@*&^%]{3,}");

    private static final int CAPS_MIN_LENGTH = 20;
    private static final int CAPS_MIN_LETTERS = 15;
    private static final double CAPS_RATIO = 0.8;
    private static final int SPECIAL_CLUSTER_LIMIT = 3;

    public GuardResult classify(String content) {
        if (content == null || content.isBlank()) {
            return GuardResult.clean();
        }
        GuardResult blocked = checkBlockedContent(content);
        if (blocked != null) {
            return blocked;
        }
        GuardResult suspicious = checkSuspiciousPatterns(content);
        return suspicious != null ? suspicious : GuardResult.clean();
    }

    private GuardResult checkBlockedContent(String content) {
        String normalized = content.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        if (anyMatch(PHONE_PATTERNS, content, normalized)) {
            return GuardResult.block("Phone number detected",
                    "Phone numbers are not allowed in messages. For your safety, please keep all transactions on SnapUp.");
        }
        if (anyMatch(EMAIL_PATTERNS, content, normalized)) {
            return GuardResult.block("Email address detected",
                    "Email addresses are not allowed in messages. For your protection, please communicate through SnapUp.");
        }
        if (anyMatch(URL_PATTERNS, content, normalized)) {
            return GuardResult.block("URL/link detected",
                    "Links and URLs are not allowed in messages. This helps protect you from phishing and scams.");
        }
        return null;
    }

    private GuardResult checkSuspiciousPatterns(String content) {
        String normalized = content.toLowerCase(Locale.ROOT).trim();

        for (String phrase : SCAM_PHRASES) {
            if (normalized.contains(phrase)) {
                return GuardResult.warn("Scam phrase detected: \"" + phrase + "\"",
                        "Your message contains a phrase that may indicate off-platform communication (\"" + phrase
                                + "\"). For your safety, all transactions should stay on SnapUp where you're protected.");
            }
        }

        if (content.length() >= CAPS_MIN_LENGTH) {
            long letters = content.chars().filter(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')).count();
            if (letters >= CAPS_MIN_LETTERS) {
                long upper = content.chars().filter(c -> c >= 'A' && c <= 'Z').count();
                double ratio = (double) upper / letters;
                if (ratio > CAPS_RATIO) {
                    return GuardResult.warn(Math.round(ratio * 100) + "% uppercase",
                            "Your message appears to be in ALL CAPS. This can come across as shouting.");
                }
            }
        }

        if (REPEATED_CHARS.matcher(content).find()) {
            return GuardResult.warn("Excessive character repetition",
                    "Your message contains excessive repeated characters. This may be flagged as spam.");
        }

        Matcher clusters = SPECIAL_CLUSTER.matcher(content);
        int clusterCount = 0;
        while (clusters.find()) {
            clusterCount++;
        }
        if (clusterCount >= SPECIAL_CLUSTER_LIMIT) {
            return GuardResult.warn("Excessive special characters",
                    "Your message contains many special characters. This may be flagged as spam.");
        }
        return null;
    }

    private boolean anyMatch(List<Pattern> patterns, String content, String normalized) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(content).find() || pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }
}
