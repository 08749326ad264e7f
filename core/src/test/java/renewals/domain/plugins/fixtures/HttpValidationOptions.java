package renewals.domain.plugins.fixtures;

import renewals.domain.plugins.ValidationPluginOptions;

public class HttpValidationOptions extends ValidationPluginOptions {
    private String path;

    public HttpValidationOptions() {
    }

    public HttpValidationOptions(final String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public void setPath(final String path) {
        this.path = path;
    }
}
