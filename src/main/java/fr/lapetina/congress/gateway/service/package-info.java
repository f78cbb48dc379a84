/**
 * Request pipeline for gateway operations.
 *
 * <h2>Pipeline Stages</h2>
 * <p>Every read, search and sub-resource call flows through the same stages:
 * <pre>
 * Static lookup → Resolve and validate → Admission → Upstream call → Envelope
 * </pre>
 * A failure at any stage ends the pipeline and is normalized to a
 * {@link fr.lapetina.congress.gateway.domain.exception.CongressApiException}.
 *
 * @see fr.lapetina.congress.gateway.service.CongressGateway
 * @see fr.lapetina.congress.gateway.service.RequestExecutor
 */
package fr.lapetina.congress.gateway.service;
