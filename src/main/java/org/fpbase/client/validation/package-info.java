/**
 * Input guards shared by the configuration, facade, and CLI layers.
 *
 * @since 0.1.0
 */
package org.fpbase.client.validation;
