/*
 * Copyright (c) 2023.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package edu.lasp.iuvs.nightside;

import edu.lasp.iuvs.core.InstrumentConstants;
import edu.lasp.iuvs.core.InstrumentSettings;
import edu.lasp.iuvs.core.IuvsConstants;
import edu.lasp.iuvs.core.IuvsProcessingException;
import edu.lasp.iuvs.core.binning.BinningScheme;
import edu.lasp.iuvs.core.calibration.CalibrationCurve;
import edu.lasp.iuvs.core.calibration.CalibrationCurveBuilder;
import edu.lasp.iuvs.core.calibration.SensitivityCurve;
import edu.lasp.iuvs.core.util.IuvsUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Retrieves per-template emission brightness from every pixel of a nightside file.
 * <p>
 * The transmitted spectra are screened for saturation, padded into the full-width spectral grid and fitted with
 * the templates rebinned to the same grid. Pixels whose fit fails are NaN in the brightness maps.
 */
public class NightsideBrightnessRetrieval {

    private final InstrumentConstants constants;
    private final SensitivityCurve sensitivityCurve;
    private final TemplateLibrary templateLibrary;
    private final List<String> fitTemplates;
    private final int numThreads;
    private final CalibrationCurveBuilder calibrationCurveBuilder;

    /**
     * @param constants        - instrument constants
     * @param sensitivityCurve - detector sensitivity
     * @param templateLibrary  - the emission templates
     * @param fitTemplates     - names of the templates to fit, in fit order
     * @param numThreads       - number of worker threads, 1 for sequential processing
     */
    public NightsideBrightnessRetrieval(InstrumentConstants constants, SensitivityCurve sensitivityCurve,
                                        TemplateLibrary templateLibrary, List<String> fitTemplates, int numThreads) {
        if (numThreads < 1) {
            throw new IllegalArgumentException("numThreads must be at least 1, got " + numThreads);
        }
        for (String name : fitTemplates) {
            if (!templateLibrary.contains(name)) {
                throw new IuvsProcessingException("Template '" + name + "' is not part of the template library " +
                                                          templateLibrary.getNames());
            }
        }
        if (templateLibrary.getNumPixels() != constants.getDetectorSpectralPixels()) {
            throw new IuvsProcessingException("Templates have " + templateLibrary.getNumPixels() +
                                                      " samples, the detector has " +
                                                      constants.getDetectorSpectralPixels() + " spectral pixels");
        }
        this.constants = constants;
        this.sensitivityCurve = sensitivityCurve;
        this.templateLibrary = templateLibrary;
        this.fitTemplates = new ArrayList<>(fitTemplates);
        this.numThreads = numThreads;
        this.calibrationCurveBuilder = new CalibrationCurveBuilder(constants);
    }

    public NightsideBrightnessProduct retrieve(NightsideObservation observation) {
        final InstrumentSettings settings = observation.getSettings();
        if (settings.isDayside(constants)) {
            throw new IuvsProcessingException(IuvsConstants.INPUT_INCONSISTENCY_ERROR_MESSAGE +
                                                      " MCP voltage " + settings.getVoltage() +
                                                      " V is a dayside setting.");
        }
        final BinningScheme binning = settings.getBinning();
        binning.validateAlignment();
        final int spectralBinWidth = binning.getSpectralBinWidth();

        final double[] gridCenters = IuvsUtils.rebinByMean(observation.getDetectorWavelengthCenters(),
                                                           spectralBinWidth);
        final CalibrationCurve calibrationCurve =
                calibrationCurveBuilder.build(sensitivityCurve, settings.withWavelengthCenters(gridCenters));

        final double[][] templates = new double[fitTemplates.size()][];
        for (int t = 0; t < templates.length; t++) {
            templates[t] = templateLibrary.rebin(fitTemplates.get(t), spectralBinWidth);
        }
        final NightsideTemplateFitter fitter = new NightsideTemplateFitter(fitTemplates, templates,
                                                                           calibrationCurve.getValues(),
                                                                           settings.getWavelengthWidth());
        final double saturationThreshold = constants.getSaturationThreshold(binning.getSpatialBinWidth(),
                                                                            spectralBinWidth);

        final int numIntegrations = observation.getNumIntegrations();
        final FitResult[][] results = new FitResult[numIntegrations][binning.getNumSpatialBins()];
        if (numThreads == 1) {
            for (int i = 0; i < numIntegrations; i++) {
                fitIntegration(observation, i, fitter, saturationThreshold, results[i]);
            }
        } else {
            fitInParallel(observation, fitter, saturationThreshold, results);
        }

        final NightsideBrightnessProduct product = new NightsideBrightnessProduct(calibrationCurve, results,
                                                                                  fitTemplates,
                                                                                  templateLibrary.getAuroraGroup());
        IuvsUtils.LOG.info("Nightside retrieval done: " + numIntegrations + " integrations, " +
                                   fitTemplates.size() + " templates, " + product.getNumFailedPixels() +
                                   " of " + numIntegrations * binning.getNumSpatialBins() + " pixels failed");
        return product;
    }

    private void fitInParallel(NightsideObservation observation, NightsideTemplateFitter fitter,
                               double saturationThreshold, FitResult[][] results) {
        final ExecutorService executorService = Executors.newFixedThreadPool(numThreads);
        final List<Callable<Object>> tasks = new ArrayList<>();
        for (int i = 0; i < results.length; i++) {
            final int integration = i;
            tasks.add(() -> {
                fitIntegration(observation, integration, fitter, saturationThreshold, results[integration]);
                return integration;
            });
        }
        try {
            final List<Future<Object>> futures = new ArrayList<>();
            for (Callable<Object> task : tasks) {
                futures.add(executorService.submit(task));
            }
            for (Future<Object> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            throw new IuvsProcessingException("Error during nightside template fit", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IuvsProcessingException(e);
        } finally {
            executorService.shutdown();
        }
    }

    private static void fitIntegration(NightsideObservation observation, int integration,
                                       NightsideTemplateFitter fitter, double saturationThreshold,
                                       FitResult[] results) {
        final BinningScheme binning = observation.getSettings().getBinning();
        for (int s = 0; s < results.length; s++) {
            final double[] spectrum = screenSaturation(observation.getSpectrum(integration, s), saturationThreshold);
            results[s] = fitter.fit(binning.padSpectrum(spectrum),
                                    binning.padSpectrum(observation.getUncertainty(integration, s)));
        }
    }

    /**
     * @return a copy of the spectrum with samples above the threshold set to NaN
     */
    static double[] screenSaturation(double[] spectrum, double saturationThreshold) {
        final double[] screened = spectrum.clone();
        for (int k = 0; k < screened.length; k++) {
            if (screened[k] > saturationThreshold) {
                screened[k] = Double.NaN;
            }
        }
        return screened;
    }
}
