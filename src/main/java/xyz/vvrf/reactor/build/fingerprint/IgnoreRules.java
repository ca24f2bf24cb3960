package xyz.vvrf.reactor.build.fingerprint;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.FilesystemException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 类 .dockerignore 的忽略规则。
 * <p>
 * 每行一条规则，{@code #} 开头为注释，{@code !} 开头为取反（重新包含）。
 * 规则可以是精确路径或 glob，匹配路径本身或其任意祖先目录。
 * glob 中 {@code *} 匹配任意字符（包括 '/'），{@code ?} 匹配单个字符，{@code [...]} 为字符集，
 * 因此 {@code *.log} 同时忽略 {@code logs/app.log}。
 * 多条规则同时命中时，最具体的规则生效：精确优先于 glob，其次路径段更多者优先，
 * 再次字面字符更多者优先；具体程度相同则后出现的规则生效。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class IgnoreRules {

    public static final String DOCKER_IGNORE = ".dockerignore";
    public static final String GIT_IGNORE = ".gitignore";

    private static final IgnoreRules EMPTY = new IgnoreRules(Collections.emptyList());
    private static final String GLOB_CHARS = "*?[]";

    private final List<Rule> rules;

    private IgnoreRules(List<Rule> rules) {
        this.rules = rules;
    }

    public static IgnoreRules empty() {
        return EMPTY;
    }

    /**
     * 解析规则文本。空行与注释被忽略。
     */
    public static IgnoreRules parse(String content) {
        Objects.requireNonNull(content, "规则文本不能为空");
        List<Rule> parsed = new ArrayList<>();
        int order = 0;
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            boolean negated = line.startsWith("!");
            String pattern = normalize(negated ? line.substring(1).trim() : line);
            if (pattern.isEmpty()) {
                continue;
            }
            try {
                parsed.add(new Rule(pattern, negated, order++));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed ignore pattern '{}': {}", line, e.getMessage());
            }
        }
        return parsed.isEmpty() ? EMPTY : new IgnoreRules(Collections.unmodifiableList(parsed));
    }

    public static IgnoreRules fromFile(Path file) {
        try {
            return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new FilesystemException(file, e);
        }
    }

    /**
     * 从构建上下文目录加载忽略规则：优先 .dockerignore，其次 .gitignore，都不存在则为空。
     */
    public static IgnoreRules load(Path contextDir) {
        Path dockerIgnore = contextDir.resolve(DOCKER_IGNORE);
        if (Files.isRegularFile(dockerIgnore)) {
            log.debug("Loading ignore rules from {}", dockerIgnore);
            return fromFile(dockerIgnore);
        }
        Path gitIgnore = contextDir.resolve(GIT_IGNORE);
        if (Files.isRegularFile(gitIgnore)) {
            log.debug("Loading ignore rules from {}", gitIgnore);
            return fromFile(gitIgnore);
        }
        return EMPTY;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    /**
     * 判断相对于上下文根目录的路径是否被忽略。
     *
     * @param relativePath 使用 '/' 分隔的相对路径
     */
    public boolean isIgnored(String relativePath) {
        if (rules.isEmpty()) {
            return false;
        }
        List<String> candidates = ancestorsOf(normalize(relativePath));
        Rule winner = null;
        for (Rule rule : rules) {
            if (rule.matchesAny(candidates) && (winner == null || rule.compareSpecificity(winner) >= 0)) {
                winner = rule;
            }
        }
        return winner != null && !winner.negated;
    }

    /**
     * 被忽略的目录下是否可能存在被取反规则重新包含的路径。
     * 返回 true 时遍历不能跳过该目录，需要逐个文件判断。
     *
     * @param directory 使用 '/' 分隔的相对目录路径
     */
    public boolean mayReincludeUnder(String directory) {
        String prefix = normalize(directory) + "/";
        for (Rule rule : rules) {
            if (!rule.negated) {
                continue;
            }
            String literal = rule.literalPrefix();
            if (literal.startsWith(prefix) || (!rule.exact && prefix.startsWith(literal))) {
                return true;
            }
        }
        return false;
    }

    private static List<String> ancestorsOf(String relativePath) {
        List<String> result = new ArrayList<>();
        String path = relativePath;
        while (!path.isEmpty()) {
            result.add(path);
            int slash = path.lastIndexOf('/');
            path = slash < 0 ? "" : path.substring(0, slash);
        }
        return result;
    }

    private static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static final class Rule {
        private final String pattern;
        private final boolean negated;
        private final int order;
        private final boolean exact;
        private final int segments;
        private final int literalChars;
        private final Pattern regex;

        Rule(String pattern, boolean negated, int order) {
            this.pattern = pattern;
            this.negated = negated;
            this.order = order;
            this.exact = pattern.chars().noneMatch(c -> GLOB_CHARS.indexOf(c) >= 0);
            this.segments = pattern.split("/").length;
            this.literalChars = (int) pattern.chars().filter(c -> GLOB_CHARS.indexOf(c) < 0).count();
            this.regex = exact ? null : compileGlob(pattern);
        }

        boolean matchesAny(List<String> candidates) {
            for (String candidate : candidates) {
                if (exact ? pattern.equals(candidate) : regex.matcher(candidate).matches()) {
                    return true;
                }
            }
            return false;
        }

        /**
         * 第一个通配符之前的字面部分；精确规则返回整个模式。
         */
        String literalPrefix() {
            if (exact) {
                return pattern;
            }
            int i = 0;
            while (i < pattern.length() && GLOB_CHARS.indexOf(pattern.charAt(i)) < 0) {
                i++;
            }
            return pattern.substring(0, i);
        }

        /**
         * @return 正数表示 this 更具体；0 表示相同（此时后出现者胜出，调用方以 >= 比较）
         */
        int compareSpecificity(Rule other) {
            if (exact != other.exact) {
                return exact ? 1 : -1;
            }
            if (segments != other.segments) {
                return Integer.compare(segments, other.segments);
            }
            if (literalChars != other.literalChars) {
                return Integer.compare(literalChars, other.literalChars);
            }
            return Integer.compare(order, other.order);
        }

        @Override
        public String toString() {
            return (negated ? "!" : "") + pattern;
        }
    }

    /**
     * 把 glob 转成正则。字符集未闭合时抛出 {@link IllegalArgumentException}。
     */
    static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                // 连续的 * 与 ** 等价
                while (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    i++;
                }
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int close = glob.indexOf(']', i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed character class in '" + glob + "'");
                }
                String body = glob.substring(i + 1, close);
                regex.append('[');
                if (body.startsWith("!")) {
                    regex.append('^');
                    body = body.substring(1);
                }
                regex.append(body.replace("\\", "\\\\").replace("[", "\\[").replace("&&", "\\&\\&"));
                regex.append(']');
                i = close;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        try {
            return Pattern.compile(regex.toString(), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(e.getDescription(), e);
        }
    }

    @Override
    public String toString() {
        return "IgnoreRules" + rules;
    }
}
