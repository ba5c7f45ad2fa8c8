package org.fpbase.client.domain.model;

/**
 * Single sample of a spectral curve.
 *
 * @param wavelength wavelength in nanometers
 * @param value normalized intensity, transmission, or efficiency at {@code wavelength}
 * @since 0.1.0
 */
public record SpectrumPoint(double wavelength, double value) {}
