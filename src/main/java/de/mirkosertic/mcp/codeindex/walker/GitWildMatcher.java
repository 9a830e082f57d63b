package de.mirkosertic.mcp.codeindex.walker;

import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.eclipse.jgit.ignore.IgnoreNode;
import org.eclipse.jgit.ignore.IgnoreNode.MatchResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches POSIX style relative paths against gitignore-style patterns using JGit's
 * {@link IgnoreNode}. The same syntax is used for include globs, exclude globs and
 * the root {@code .gitignore}.
 * <p>
 * A path matches when the path itself or any of its parent directories matches, so
 * a directory pattern such as {@code build/} also matches {@code build/out.txt}.
 * Later rules win over earlier ones, which makes negations ({@code !keep.py}) work.
 */
public final class GitWildMatcher {

    private static final Logger logger = LoggerFactory.getLogger(GitWildMatcher.class);

    static final String GITIGNORE_FILE = ".gitignore";

    private final IgnoreNode node;

    private GitWildMatcher(final IgnoreNode node) {
        this.node = node;
    }

    /**
     * Build a matcher from a list of patterns. Blank lines and comments are ignored.
     */
    public static GitWildMatcher fromPatterns(final List<String> patterns) {
        final List<FastIgnoreRule> rules = new ArrayList<>();
        for (final String pattern : patterns) {
            if (pattern == null) {
                continue;
            }
            final String trimmed = pattern.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            rules.add(new FastIgnoreRule(trimmed));
        }
        return new GitWildMatcher(new IgnoreNode(rules));
    }

    /**
     * Load the {@code .gitignore} located directly in {@code root}. Nested ignore files are
     * not consulted.
     *
     * @return the matcher, or {@code null} if there is no readable root ignore file
     */
    public static @Nullable GitWildMatcher fromGitignore(final Path root) {
        final Path gitignore = root.resolve(GITIGNORE_FILE);
        if (!Files.isRegularFile(gitignore)) {
            return null;
        }
        final IgnoreNode node = new IgnoreNode();
        try (final InputStream in = Files.newInputStream(gitignore)) {
            node.parse(in);
        } catch (final IOException e) {
            logger.debug("Could not read {}: {}", gitignore, e.getMessage());
            return null;
        }
        return new GitWildMatcher(node);
    }

    public boolean isEmpty() {
        return node.getRules().isEmpty();
    }

    public boolean matchesFile(final String relativePath) {
        return matches(relativePath, false);
    }

    public boolean matchesDirectory(final String relativePath) {
        return matches(relativePath, true);
    }

    private boolean matches(final String relativePath, final boolean directory) {
        int slash = relativePath.indexOf('/');
        while (slash > 0) {
            if (node.isIgnored(relativePath.substring(0, slash), true) == MatchResult.IGNORED) {
                return true;
            }
            slash = relativePath.indexOf('/', slash + 1);
        }
        return node.isIgnored(relativePath, directory) == MatchResult.IGNORED;
    }
}
