/**
 * Contract tests for SPI implementations.
 *
 * <p>Adapter modules extend
 * {@link com.ryuqq.provisioning.testkit.contract.AbstractAppStoreContractTest}
 * in their test sources to check an {@link com.ryuqq.provisioning.core.spi.AppStore}
 * implementation against the SPI contract.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.testkit.contract;
