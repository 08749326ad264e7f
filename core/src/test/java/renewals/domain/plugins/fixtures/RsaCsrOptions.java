package renewals.domain.plugins.fixtures;

import renewals.domain.plugins.CsrPluginOptions;

public class RsaCsrOptions extends CsrPluginOptions {
    private int keySize;

    public RsaCsrOptions() {
    }

    public RsaCsrOptions(final int keySize) {
        this.keySize = keySize;
    }

    public int getKeySize() {
        return keySize;
    }

    public void setKeySize(final int keySize) {
        this.keySize = keySize;
    }
}
