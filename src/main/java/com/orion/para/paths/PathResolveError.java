package com.orion.para.paths;

import com.orion.para.ParaError;
import com.orion.para.ParaErrorCode;

import java.util.List;

/**
 * Resolver failure, carrying the offending path or category.
 */
public class PathResolveError extends ParaError {
    private final String path;
    private final String category;
    private final List<String> valid;

    private PathResolveError(ParaErrorCode code, String message, String path, String category, List<String> valid) {
        super(code, message, null);
        this.path = path;
        this.category = category;
        this.valid = valid != null ? List.copyOf(valid) : List.of();
    }

    public static PathResolveError notParaPath(String path) {
        return new PathResolveError(ParaErrorCode.NOT_PARA_PATH,
            "Path '" + path + "' is not a valid PARA path", path, null, null);
    }

    public static PathResolveError invalidCategory(String category, List<String> valid) {
        return new PathResolveError(ParaErrorCode.INVALID_CATEGORY,
            "Invalid category '" + category + "'. Valid categories: " + String.join(", ", valid),
            null, category, valid);
    }

    public String getPath() {
        return path;
    }

    public String getCategory() {
        return category;
    }

    public List<String> getValid() {
        return valid;
    }
}
