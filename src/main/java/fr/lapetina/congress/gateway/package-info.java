/**
 * Congress.gov gateway - validated, rate-limited access to the Congress.gov v3 legislative API.
 *
 * <p>Every resource is addressed by a {@code congress-gov://} identifier. The gateway checks the
 * identifier against a fixed grammar, validates its fields, reserves a slot in a rolling admission
 * window and only then calls the upstream API. Results come back wrapped in a uniform envelope;
 * failures come back as a {@link fr.lapetina.congress.gateway.domain.exception.CongressApiException}
 * carrying one {@link fr.lapetina.congress.gateway.domain.model.ErrorKind}.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.congress.gateway.GatewayFactory} - Main entry point for creating
 *       a fully-configured gateway from YAML configuration</li>
 *   <li>{@link fr.lapetina.congress.gateway.CongressGatewayApplication} - Standalone HTTP server
 *       exposing the gateway as a JSON API</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("config.yaml").start()) {
 *     CongressGateway gateway = factory.getGateway();
 *
 *     ResourceContents contents = gateway.readResource("congress-gov://bill/118/hr/1/actions").get();
 *     System.out.println(contents.first().text());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Identifier grammar covering bills, members, committees, amendments, laws, nominations,
 *       treaties, the Congressional Record, communications, CRS reports and House votes</li>
 *   <li>Admission control with a rolling window shared by all callers</li>
 *   <li>Hot-reload of admission limits without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.congress.gateway.GatewayFactory
 * @see fr.lapetina.congress.gateway.service.CongressGateway
 */
package fr.lapetina.congress.gateway;
