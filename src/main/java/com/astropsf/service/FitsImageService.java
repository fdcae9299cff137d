package com.astropsf.service;

import com.astropsf.model.Image;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FitsImageService {

    private static final Logger log = LoggerFactory.getLogger(FitsImageService.class);

    private final FitsHeaderService headerService;

    public FitsImageService() {
        this(new FitsHeaderService());
    }

    public FitsImageService(FitsHeaderService headerService) {
        this.headerService = headerService;
    }

    public static class FitsImage {
        public final Image image;
        public final FitsHeaderService.FitsMetadata metadata;

        FitsImage(Image image, FitsHeaderService.FitsMetadata metadata) {
            this.image = image;
            this.metadata = metadata;
        }
    }

    public Image load(File fitsFile) throws IOException, FitsException {
        return read(fitsFile).image;
    }

    // Primary HDU only; BZERO/BSCALE go to integer data, non-finite samples are sanitized.
    public FitsImage read(File fitsFile) throws IOException, FitsException {
        try (Fits fits = new Fits(fitsFile)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsException("No HDU in " + fitsFile);
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0.0);
            double bscale = header.getDoubleValue("BSCALE", 1.0);

            double[][] data = toDouble(hdu.getKernel(), bzero, bscale);
            if (data.length == 0 || data[0].length == 0) {
                throw new FitsException("Primary HDU of " + fitsFile.getName() + " does not hold a 2-D image");
            }
            Image image = Image.sanitized(data);
            log.info("Loaded {} ({}x{}, BZERO={}, BSCALE={})", fitsFile.getName(), image.getWidth(), image.getHeight(), bzero, bscale);
            return new FitsImage(image, headerService.readHeader(header));
        }
    }

    // Floating-point HDUs carry physical values already; integer ones are scaled.
    static double[][] toDouble(Object k, double bzero, double bscale) {
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][];
            for (int i = 0; i < f.length; i++) {
                d[i] = new double[f[i].length];
                for (int j = 0; j < f[i].length; j++) d[i][j] = f[i][j];
            }
            return d;
        }
        if (k instanceof double[][]) {
            double[][] src = (double[][]) k;
            double[][] d = new double[src.length][];
            for (int i = 0; i < src.length; i++) d[i] = src[i].clone();
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            double[][] d = new double[s.length][];
            for (int i = 0; i < s.length; i++) {
                d[i] = new double[s[i].length];
                for (int j = 0; j < s[i].length; j++) d[i][j] = bzero + bscale * (s[i][j] & 0xFF);
            }
            return d;
        }
        return new double[0][0];
    }
}
