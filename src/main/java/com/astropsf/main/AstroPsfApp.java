package com.astropsf.main;

import com.astropsf.exception.PhotometryException;
import com.astropsf.model.AppConfig;
import com.astropsf.model.PhotometryReport;
import com.astropsf.model.PhotometryResult;
import com.astropsf.model.PhotometrySession;
import com.astropsf.model.StarCandidate;
import com.astropsf.model.StarRole;
import com.astropsf.service.FitsHeaderService;
import com.astropsf.service.FitsImageService;
import com.astropsf.service.PhotometryPipelineService;
import java.io.File;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class AstroPsfApp {

    private static final Logger log = LoggerFactory.getLogger(AstroPsfApp.class);

    public static void main(String[] args) {
        System.exit(run(args, AppConfig.userConfig(), System.out));
    }

    static int run(String[] args, AppConfig config, PrintStream out) {
        if (args.length < 5 || args.length > 6) {
            out.println("usage: AstroPsfApp <fits> <targetX> <targetY> <compX> <compY> [compMag]");
            return 2;
        }
        File file = new File(args[0]);
        try {
            PhotometrySession session = PhotometrySession.from(config);
            session.addStar(new StarCandidate(parse("targetX", args[1]), parse("targetY", args[2]), StarRole.TARGET));
            session.addStar(new StarCandidate(parse("compX", args[3]), parse("compY", args[4]), StarRole.COMPARISON));
            if (args.length == 6) session.setComparisonMagnitude(parse("compMag", args[5]));

            FitsImageService.FitsImage fits = new FitsImageService().read(file);

            PhotometryReport report;
            try (PhotometryPipelineService pipeline = new PhotometryPipelineService(
                    Runtime.getRuntime().availableProcessors(), config.getFwhmPatchSize())) {
                report = pipeline.run(fits.image, session);
            }
            print(out, file, fits.metadata, report);
            return 0;
        } catch (PhotometryException e) {
            log.error("PSF photometry failed: {}", e.getMessage());
            if (e.getPartialReport() != null) print(out, file, null, e.getPartialReport());
            out.println("ERROR: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Cannot process {}", file, e);
            out.println("ERROR: " + e.getMessage());
            return 1;
        }
    }

    private static double parse(String name, String text) throws PhotometryException {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new PhotometryException(name + " is not a number: '" + text + "'", e);
        }
    }

    private static void print(PrintStream out, File file, FitsHeaderService.FitsMetadata meta, PhotometryReport r) {
        out.println("File: " + file.getName());
        if (meta != null) {
            out.printf(Locale.US, "Object: %s | Date: %s | Filter: %s | Exp: %.1fs%n", meta.object, meta.dateObs, meta.filter, meta.exposureTime);
        }
        out.println("--------------------------------------------------");
        if (r.targetFwhm != null) out.println(r.targetFwhm);
        if (r.comparisonFwhm != null) out.println(r.comparisonFwhm);
        if (r.geometry != null) out.println("Geometry: " + r.geometry);
        for (PhotometryResult p : r.targetResults) out.println(p);
        for (PhotometryResult p : r.comparisonResults) out.println(p);
        if (r.magnitude != null) out.println(r.magnitude);
    }
}
