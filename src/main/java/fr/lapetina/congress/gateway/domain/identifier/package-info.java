/**
 * Identifier grammar.
 *
 * <p>{@link fr.lapetina.congress.gateway.domain.identifier.IdentifierParser} splits the string,
 * {@link fr.lapetina.congress.gateway.domain.identifier.ResourceRouteTable} lists the accepted
 * shapes, and {@link fr.lapetina.congress.gateway.domain.identifier.IdentifierDispatcher} picks
 * the first matching shape and validates its fields.
 */
package fr.lapetina.congress.gateway.domain.identifier;
