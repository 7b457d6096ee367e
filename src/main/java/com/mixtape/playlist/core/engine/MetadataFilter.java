package com.mixtape.playlist.core.engine;

import com.mixtape.playlist.core.model.TrackMetadata;

import java.util.Locale;

/**
 * Shows entries whose title, artist or album contains a text, ignoring case.
 * Reads the store on every call, so it always reflects the current contents.
 */
public final class MetadataFilter implements DisplayFilter {

    private final ItemStore store;
    private final String text;

    public MetadataFilter(ItemStore store, String text) {
        this.store = store;
        this.text = text.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean accepts(int row) {
        if (!store.hasItemAt(row)) {
            return false;
        }
        TrackMetadata metadata = store.get(row).getMetadata();
        return contains(metadata.title()) || contains(metadata.artist()) || contains(metadata.album());
    }

    private boolean contains(String value) {
        return value.toLowerCase(Locale.ROOT).contains(text);
    }

    public String text() {
        return text;
    }
}
