package org.projectstate.codec;

import com.google.gson.JsonElement;

/**
 * A pair of pure conversions for one field: live container to portable JSON and back.
 * {@link #fromPortable} must tolerate anything a stored snapshot may hold and never throw.
 *
 * @param <L> live type
 */
public interface FieldConverter<L> {

    JsonElement toPortable(L live);

    L fromPortable(JsonElement portable);
}
