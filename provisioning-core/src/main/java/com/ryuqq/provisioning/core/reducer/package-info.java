/**
 * Event reducer package.
 *
 * <p>{@link com.ryuqq.provisioning.core.reducer.AppReducer} folds one event onto a
 * snapshot. It is pure and total: illegal events are recorded as a transition to
 * CORRUPTED instead of being thrown.</p>
 *
 * <h2>Transition Table</h2>
 * <pre>
 * ExistingInfrastructureSelected  NEW/NotSelected → NEW/Selected       else CORRUPTED
 * AppActivated                    NEW/Selected    → ACTIVE             else CORRUPTED
 * AppDeleted                      NEW | ACTIVE    → DELETED            else CORRUPTED
 * BuildRequested                  any             → unchanged
 * AppCreated                      existing        → ignored
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * AppSnapshot snapshot = AppReducer.create(new AppCreated(uuid));
 * snapshot = AppReducer.apply(snapshot, new ExistingInfrastructureSelected(uuid, InfrastructureChoice.azure()));
 * snapshot = AppReducer.apply(snapshot, new AppActivated(uuid));
 *
 * Optional&lt;AppSnapshot&gt; rebuilt = AppReducer.replay(history);
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.reducer;
