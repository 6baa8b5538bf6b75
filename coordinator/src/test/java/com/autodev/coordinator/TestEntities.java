package com.autodev.coordinator;

import java.util.UUID;

/** Test object helpers shared by the unit and slice tests. */
public final class TestEntities {

    private TestEntities() {}

    /** Reflectively set the id, since it is normally set by JPA on persist. */
    public static <T> T withId(T entity, UUID id) {
        try {
            var f = entity.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(entity, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return entity;
    }

    public static <T> T withId(T entity) {
        return withId(entity, UUID.randomUUID());
    }
}
