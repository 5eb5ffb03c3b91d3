package com.orion.para.paths;

import com.orion.para.AppConfig;
import com.orion.para.ParaResult;

import java.util.Locale;
import java.util.Optional;

/**
 * Translates logical addresses into namespace-relative physical paths and back.
 *
 * Accepted address forms:
 *   para://projects/q1     scheme-prefixed URI
 *   Orion/Projects/q1      namespace-rooted path
 *   projects/q1            bare category-relative path
 *
 * All three resolve to {@code Orion/Projects/q1}. Entity categories get the
 * storage extension appended once: {@code para://contacts/john} resolves to
 * {@code Orion/Resources/contacts/john.yaml}.
 */
public class ParaPathResolver {

    private final String rootName;
    private final String scheme;
    private final String schemePrefix;

    public ParaPathResolver() {
        this(AppConfig.DEFAULT_ROOT_NAME, AppConfig.DEFAULT_SCHEME);
    }

    public ParaPathResolver(String rootName, String scheme) {
        this.rootName = rootName;
        this.scheme = scheme.toLowerCase(Locale.ROOT);
        this.schemePrefix = this.scheme + "://";
    }

    public String getRootName() {
        return rootName;
    }

    public String getScheme() {
        return scheme;
    }

    public ParaResult<String> resolve(String address) {
        if (address == null) {
            return ParaResult.err(PathResolveError.notParaPath(null));
        }

        if (address.regionMatches(true, 0, schemePrefix, 0, schemePrefix.length())) {
            return resolveBody(address.substring(schemePrefix.length()));
        }

        if (isParaPath(address)) {
            return resolveBody(address.substring(rootName.length()));
        }

        String firstSegment = address.split("/", -1)[0];
        if (ParaCategory.fromName(firstSegment).isPresent()) {
            return resolveBody(address);
        }

        return ParaResult.err(PathResolveError.notParaPath(address));
    }

    /**
     * Best-effort inverse of {@link #resolve}: {@code Orion/Projects/q1} becomes
     * {@code para://projects/q1}.
     */
    public ParaResult<String> toLogicalAddress(String physicalPath) {
        if (!isParaPath(physicalPath)) {
            return ParaResult.err(PathResolveError.notParaPath(physicalPath));
        }
        String body = normalize(physicalPath.substring(rootName.length()));
        if (body.isEmpty()) {
            return ParaResult.ok(schemePrefix);
        }
        int slash = body.indexOf('/');
        String first = slash >= 0 ? body.substring(0, slash) : body;
        String rest = slash >= 0 ? body.substring(slash) : "";
        return ParaResult.ok(schemePrefix + first.toLowerCase(Locale.ROOT) + rest);
    }

    /**
     * True when the path is the namespace root or lies beneath it.
     * {@code OrionExtra/file} is not a PARA path.
     */
    public boolean isParaPath(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        return path.equals(rootName) || path.startsWith(rootName + "/");
    }

    /**
     * Join segments under the namespace root: {@code buildPath("Projects", "q1")}
     * gives {@code Orion/Projects/q1}.
     */
    public String buildPath(String... segments) {
        StringBuilder sb = new StringBuilder(rootName);
        for (String segment : segments) {
            sb.append('/').append(segment);
        }
        return sb.toString();
    }

    private ParaResult<String> resolveBody(String body) {
        String normalized = normalize(body);
        if (normalized.isEmpty()) {
            return ParaResult.ok(rootName);
        }

        int slash = normalized.indexOf('/');
        String categoryName = (slash >= 0 ? normalized.substring(0, slash) : normalized).toLowerCase(Locale.ROOT);
        String rest = slash >= 0 ? normalized.substring(slash + 1) : "";

        Optional<ParaCategory> category = ParaCategory.fromName(categoryName);
        if (category.isEmpty()) {
            return ParaResult.err(PathResolveError.invalidCategory(categoryName, ParaCategory.names()));
        }

        StringBuilder resolved = new StringBuilder(rootName).append('/').append(category.get().getDirectory());
        if (!rest.isEmpty()) {
            resolved.append('/').append(rest);
            if (category.get().hasEntityFiles() && !rest.endsWith(ParaCategory.ENTITY_EXTENSION)) {
                resolved.append(ParaCategory.ENTITY_EXTENSION);
            }
        }
        return ParaResult.ok(resolved.toString());
    }

    // Drops leading and trailing separators and collapses repeated ones.
    private static String normalize(String path) {
        return path.replaceAll("/+", "/").replaceAll("^/", "").replaceAll("/$", "");
    }
}
