package renewals.domain.plugins.fixtures;

import renewals.domain.plugins.InstallationPluginOptions;

public class ScriptInstallationOptions extends InstallationPluginOptions {
    private String script;

    public ScriptInstallationOptions() {
    }

    public ScriptInstallationOptions(final String script) {
        this.script = script;
    }

    public String getScript() {
        return script;
    }

    public void setScript(final String script) {
        this.script = script;
    }
}
