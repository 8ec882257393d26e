/**
 * Domain event catalog.
 *
 * <p>Immutable records of app state changes. Events carry data only; whether an
 * event is legal for a given snapshot is decided by the reducer.</p>
 *
 * <h2>Events</h2>
 * <pre>
 * AppCreated                      {uuid}
 * ExistingInfrastructureSelected  {uuid, infrastructure: Aws{region} | Azure}
 * BuildRequested                  {uuid, infrastructure: Aws{region} | Azure}
 * AppActivated                    {uuid}
 * AppDeleted                      {uuid}
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.event;
