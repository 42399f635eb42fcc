package com.numaansystems.headersso.model;

import java.io.Serializable;

/**
 * Role row joined onto a {@link UserRecord} when the lookup asks for it.
 *
 * @param slug        unique role identifier, e.g. {@code global:member}
 * @param displayName human readable name
 */
public record Role(String slug, String displayName) implements Serializable {
}
