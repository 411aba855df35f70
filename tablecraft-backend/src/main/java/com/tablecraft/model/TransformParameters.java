package com.tablecraft.model;

/**
 * Typed parameters of one transformation request.
 *
 * <p>There is exactly one implementation per {@link TransformationType}; the request binder
 * produces them from the loosely typed wire parameters, so the engine components never see an
 * invalid combination of keys.
 */
public interface TransformParameters {

    TransformationType type();
}
