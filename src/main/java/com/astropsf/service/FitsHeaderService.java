package com.astropsf.service;

import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;

public class FitsHeaderService {

    public static class FitsMetadata {
        public String object = "";
        public String dateObs = "";
        public String filter = "";
        public double exposureTime = 0;
    }

    public FitsMetadata readHeader(File f) throws IOException, FitsException {
        try (Fits fits = new Fits(f)) {
            return readHeader(fits.getHDU(0).getHeader());
        }
    }

    public FitsMetadata readHeader(Header header) {
        FitsMetadata meta = new FitsMetadata();
        meta.object = orEmpty(header.getStringValue("OBJECT"));
        meta.dateObs = orEmpty(header.getStringValue("DATE-OBS"));
        meta.filter = orEmpty(header.getStringValue("FILTER"));

        // EXPTIME is standard, some capture programs write EXPOSURE instead
        meta.exposureTime = header.getDoubleValue("EXPTIME", 0);
        if (meta.exposureTime == 0) meta.exposureTime = header.getDoubleValue("EXPOSURE", 0);
        return meta;
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
