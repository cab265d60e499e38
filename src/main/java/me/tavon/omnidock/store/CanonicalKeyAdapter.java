package me.tavon.omnidock.store;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import me.tavon.omnidock.channel.CanonicalKey;

import java.io.IOException;

/**
 * Writes keys as their {@code platform:id} string.
 */
public class CanonicalKeyAdapter extends TypeAdapter<CanonicalKey> {

    @Override
    public void write(JsonWriter out, CanonicalKey key) throws IOException {
        if (key == null) {
            out.nullValue();
            return;
        }

        out.value(key.toString());
    }

    @Override
    public CanonicalKey read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }

        String value = in.nextString();

        try {
            return CanonicalKey.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IOException("bad key " + value, e);
        }
    }
}
