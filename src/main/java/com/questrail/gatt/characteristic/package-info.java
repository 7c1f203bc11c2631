/**
 * The characteristic contract and the generic parse/build wrappers.
 *
 * <p>
 * A concrete characteristic is a small immutable object: identity,
 * {@link com.questrail.gatt.validation.ValidationConstraints}, an optional
 * {@link com.questrail.gatt.characteristic.DependencyDeclaration}, a
 * {@link com.questrail.gatt.codec.template.TemplateKind} tag, and a
 * decode/encode pair built from the primitive codecs.
 * </p>
 *
 * <p>
 * Validation, dependency checks and error wrapping live in
 * {@link com.questrail.gatt.characteristic.ParsePipeline} and are never
 * repeated by concrete decoders.
 * </p>
 */
package com.questrail.gatt.characteristic;
