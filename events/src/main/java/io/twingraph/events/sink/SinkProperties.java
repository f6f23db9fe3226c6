package io.twingraph.events.sink;

/**
 * Settings shared by every configured sink.
 */
public abstract class SinkProperties {

    private String name;
    private boolean enabled = true;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
