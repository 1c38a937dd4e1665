/**
 * In-memory Resource Client adapter implementation package.
 *
 * <p>This package provides a reference implementation of the ResourceClient SPI
 * that simulates an eventually consistent DNS zone backend.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.reconciler.adapter.inmemory.client.InMemoryResourceClient}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.reconciler.core.spi.ResourceClient}</li>
 *   <li>{@link com.ryuqq.reconciler.adapter.inmemory.client.InMemoryBackendConfig}:
 *       Read-counted transition timing</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.reconciler.core.spi.ResourceClient
 * @author Reconciler Team
 * @since 1.0.0
 */
package com.ryuqq.reconciler.adapter.inmemory.client;
