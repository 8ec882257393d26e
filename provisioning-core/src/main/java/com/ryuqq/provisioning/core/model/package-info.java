/**
 * Core domain model package containing value objects and the app snapshot.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.model.AppId} - App unique identifier</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.AwsRegion} - AWS region tag</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.Infrastructure} - Infrastructure selection (NotSelected | Selected)</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.AppSnapshot} - Materialized state of one app</li>
 * </ul>
 *
 * <h2>Persisted Layout</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.model.PersistedAppState} - Flat storage row</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.PersistedAppStates} - Row to snapshot mapping</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructors reject nulls; structural invariants are checked on reconstruction</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.model;
