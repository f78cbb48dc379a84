/**
 * Domain model classes for the gateway.
 *
 * <p>This package contains immutable value objects and the closed enumerations of upstream codes.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.congress.gateway.domain.model.ResourceRequest} - A resolved, validated upstream request</li>
 *   <li>{@link fr.lapetina.congress.gateway.domain.model.ResponseEnvelope} - Uniform success wrapper</li>
 *   <li>{@link fr.lapetina.congress.gateway.domain.model.ResourceCollection} - Top-level identifier collections</li>
 *   <li>{@link fr.lapetina.congress.gateway.domain.model.ErrorKind} - Closed error taxonomy</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records copy their collections on construction and expose unmodifiable views, so every
 * instance can be shared between threads.
 */
package fr.lapetina.congress.gateway.domain.model;
