package com.ogt.exposure.io;

import com.ogt.exposure.exception.CrsMissingException;
import com.ogt.exposure.exception.MalformedTableException;
import com.ogt.exposure.model.Crs;
import com.ogt.exposure.model.RasterGrid;
import lombok.extern.slf4j.Slf4j;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-band GeoTIFF rasters (DEMs) read with tiff-java. Georeferencing comes from the
 * ModelPixelScale and ModelTiepoint tags, the CRS from the GeoKey directory and nodata from the
 * GDAL_NODATA tag. Only north-up grids with square cells are supported.
 */
@Component
@Slf4j
public class GeoTiffReader implements RasterProvider {

    static final int MODEL_PIXEL_SCALE = 33550;
    static final int MODEL_TIEPOINT = 33922;
    static final int GEO_KEY_DIRECTORY = 34735;
    static final int GDAL_NODATA = 42113;

    static final int RASTER_TYPE_KEY = 1025;
    static final int GEOGRAPHIC_TYPE_KEY = 2048;
    static final int PROJECTED_CS_TYPE_KEY = 3072;
    static final int RASTER_PIXEL_IS_POINT = 2;
    static final int USER_DEFINED = 32767;

    @Override
    public RasterGrid read(String source, Crs crs) {
        try {
            TIFFImage image = TiffReader.readTiff(new File(source));
            RasterGrid grid = read(image, crs, source);
            log.info("🗺️ Read {}x{} GeoTIFF '{}' (cell size {}, {})", grid.getColumns(), grid.getRows(), source,
                    grid.getCellSize(), grid.getCrs());
            return grid;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read GeoTIFF " + source, e);
        }
    }

    public RasterGrid read(TIFFImage image, Crs crs, String name) {
        if (image.getFileDirectories().isEmpty()) {
            throw new MalformedTableException("GeoTIFF '" + name + "' has no image");
        }
        FileDirectory directory = image.getFileDirectory();
        Map<Integer, Object> tags = tagValues(directory);

        // 1. Georeferencing
        double[] scale = doubles(tags.get(MODEL_PIXEL_SCALE));
        double[] tiepoint = doubles(tags.get(MODEL_TIEPOINT));
        if (scale.length < 2 || tiepoint.length < 6) {
            throw new MalformedTableException("GeoTIFF '" + name + "' is not georeferenced (no ModelPixelScale/ModelTiepoint)");
        }
        int[] geoKeys = ints(tags.get(GEO_KEY_DIRECTORY));
        Crs gridCrs = crsOf(geoKeys, crs, name);
        Integer rasterType = geoKey(geoKeys, RASTER_TYPE_KEY);
        boolean pixelIsPoint = rasterType != null && rasterType == RASTER_PIXEL_IS_POINT;
        Double nodata = noData(tags.get(GDAL_NODATA), name);

        // 2. First band, top row first
        Rasters rasters;
        try {
            rasters = directory.readRasters();
        } catch (TiffException e) {
            throw new MalformedTableException("GeoTIFF '" + name + "' cannot be decoded: " + e.getMessage(), e);
        }
        int width = rasters.getWidth();
        int height = rasters.getHeight();
        double[] values = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Number sample = rasters.getFirstPixelSample(x, y);
                values[y * width + x] = sample == null ? Double.NaN : sample.doubleValue();
            }
        }
        return georeference(width, height, scale, tiepoint, pixelIsPoint, gridCrs, nodata, values, name);
    }

    /**
     * Grid whose upper-left corner follows from the tiepoint (pixel i,j at model x,y). A
     * PixelIsPoint tiepoint refers to the cell centre and is moved half a cell to the corner.
     */
    static RasterGrid georeference(int width, int height, double[] scale, double[] tiepoint, boolean pixelIsPoint,
                                   Crs crs, Double nodata, double[] values, String name) {
        double sx = scale[0];
        double sy = scale[1];
        if (sx <= 0 || sy <= 0 || Math.abs(sx - sy) > 1e-9 * Math.max(sx, sy)) {
            throw new MalformedTableException(String.format(
                    "GeoTIFF '%s' needs square cells, got %s x %s", name, sx, sy));
        }
        double originX = tiepoint[3] - tiepoint[0] * sx;
        double originY = tiepoint[4] + tiepoint[1] * sy;
        if (pixelIsPoint) {
            originX -= sx / 2;
            originY += sy / 2;
        }
        return RasterGrid.builder()
                .crs(crs)
                .originX(originX)
                .originY(originY)
                .cellSize(sx)
                .columns(width)
                .rows(height)
                .values(values)
                .nodata(nodata)
                .build();
    }

    /** Projected CRS key first, then the geographic one; user-defined codes fall back to {@code fallback}. */
    static Crs crsOf(int[] geoKeys, Crs fallback, String name) {
        Integer code = geoKey(geoKeys, PROJECTED_CS_TYPE_KEY);
        if (code == null || code == USER_DEFINED) {
            code = geoKey(geoKeys, GEOGRAPHIC_TYPE_KEY);
        }
        if (code != null && code > 0 && code != USER_DEFINED) {
            return Crs.ofEpsg(code);
        }
        if (fallback == null) {
            throw new CrsMissingException(name);
        }
        log.debug("GeoTIFF '{}' carries no EPSG code, using {}", name, fallback);
        return fallback;
    }

    /**
     * Inline value of one key of a GeoKey directory: a 4-short header (version, revision, minor,
     * key count) then 4 shorts per key (id, location, count, value).
     */
    static Integer geoKey(int[] geoKeys, int key) {
        if (geoKeys == null || geoKeys.length < 4) {
            return null;
        }
        for (int i = 0; i < geoKeys[3]; i++) {
            int base = 4 + 4 * i;
            if (base + 3 >= geoKeys.length) {
                break;
            }
            if (geoKeys[base] == key && geoKeys[base + 1] == 0) {
                return geoKeys[base + 3];
            }
        }
        return null;
    }

    static Double noData(Object raw, String name) {
        if (raw == null) {
            return null;
        }
        String text = raw instanceof Collection<?> c ? (c.isEmpty() ? "" : String.valueOf(c.iterator().next()))
                : raw instanceof Number n ? n.toString()
                : raw.toString();
        text = text.replace("\u0000", "").trim();
        if (text.isEmpty() || text.equalsIgnoreCase("nan")) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedTableException("GeoTIFF '" + name + "': GDAL_NODATA '" + text + "' is not a number", e);
        }
    }

    private static Map<Integer, Object> tagValues(FileDirectory directory) {
        Map<Integer, Object> tags = new HashMap<>();
        for (FileDirectoryEntry entry : directory.getEntries()) {
            if (entry.getFieldTag() != null) {
                tags.put(entry.getFieldTag().getId(), entry.getValues());
            }
        }
        return tags;
    }

    static double[] doubles(Object raw) {
        List<Number> numbers = new ArrayList<>();
        collectNumbers(raw, numbers);
        return numbers.stream().mapToDouble(Number::doubleValue).toArray();
    }

    static int[] ints(Object raw) {
        List<Number> numbers = new ArrayList<>();
        collectNumbers(raw, numbers);
        return numbers.stream().mapToInt(Number::intValue).toArray();
    }

    private static void collectNumbers(Object raw, List<Number> out) {
        if (raw instanceof Number n) {
            out.add(n);
        } else if (raw instanceof Collection<?> c) {
            c.forEach(o -> collectNumbers(o, out));
        } else if (raw instanceof Object[] array) {
            for (Object o : array) {
                collectNumbers(o, out);
            }
        } else if (raw instanceof double[] array) {
            for (double d : array) {
                out.add(d);
            }
        } else if (raw instanceof int[] array) {
            for (int i : array) {
                out.add(i);
            }
        }
    }
}
