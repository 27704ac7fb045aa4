package com.ogt.exposure.io;

import com.ogt.exposure.exception.CrsMissingException;
import com.ogt.exposure.exception.MalformedTableException;
import com.ogt.exposure.model.RasterGrid;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ogt.exposure.TestLayers.UTM31N;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GeoTiffReaderTest {

    private final GeoTiffReader reader = new GeoTiffReader();

    private static final double[] VALUES = {1, 2, 3, 4, -9999, 6};

    @Test
    void cornerTiepointGivesUpperLeftOrigin() {
        RasterGrid grid = GeoTiffReader.georeference(3, 2, new double[]{10, 10, 0},
                new double[]{0, 0, 0, 100, 220, 0}, false, UTM31N, -9999.0, VALUES, "dem.tif");

        assertEquals(100.0, grid.getOriginX());
        assertEquals(220.0, grid.getOriginY());
        assertEquals(1.0, grid.sample(105, 215));
        assertEquals(6.0, grid.sample(125, 205));
        assertNull(grid.sample(115, 205));
    }

    @Test
    void tiepointOnInnerPixelIsMovedBackToTheCorner() {
        RasterGrid grid = GeoTiffReader.georeference(3, 2, new double[]{10, 10, 0},
                new double[]{1, 1, 0, 110, 210, 0}, false, UTM31N, null, VALUES, "dem.tif");

        assertEquals(100.0, grid.getOriginX());
        assertEquals(220.0, grid.getOriginY());
    }

    @Test
    void pixelIsPointShiftsHalfACell() {
        RasterGrid grid = GeoTiffReader.georeference(3, 2, new double[]{10, 10, 0},
                new double[]{0, 0, 0, 5, 15, 0}, true, UTM31N, null, VALUES, "dem.tif");

        assertEquals(0.0, grid.getOriginX());
        assertEquals(20.0, grid.getOriginY());
        assertEquals(2.0, grid.sample(15, 15));
    }

    @Test
    void rectangularCellsAreRejected() {
        assertThrows(MalformedTableException.class, () -> GeoTiffReader.georeference(3, 2, new double[]{10, 5, 0},
                new double[]{0, 0, 0, 0, 0, 0}, false, UTM31N, null, VALUES, "dem.tif"));
    }

    @Test
    void crsComesFromGeoKeysBeforeTheCallerDefault() {
        int[] projected = {1, 1, 0, 2, 1024, 0, 1, 1, 3072, 0, 1, 32631};
        int[] userDefined = {1, 1, 0, 1, 3072, 0, 1, 32767};

        assertEquals(UTM31N, GeoTiffReader.crsOf(projected, null, "dem.tif"));
        assertEquals(UTM31N, GeoTiffReader.crsOf(userDefined, UTM31N, "dem.tif"));
        assertThrows(CrsMissingException.class, () -> GeoTiffReader.crsOf(new int[0], null, "dem.tif"));
    }

    @Test
    void rasterTypeKeyIsReadInline() {
        int[] keys = {1, 1, 0, 2, 1025, 0, 1, 2, 2048, 0, 1, 4326};

        assertEquals(2, GeoTiffReader.geoKey(keys, GeoTiffReader.RASTER_TYPE_KEY));
        assertEquals(4326, GeoTiffReader.geoKey(keys, GeoTiffReader.GEOGRAPHIC_TYPE_KEY));
        assertNull(GeoTiffReader.geoKey(keys, GeoTiffReader.PROJECTED_CS_TYPE_KEY));
    }

    @Test
    void gdalNoDataIsParsedFromAscii() {
        assertEquals(-9999.0, GeoTiffReader.noData("-9999\u0000", "dem.tif"));
        assertEquals(-32767.0, GeoTiffReader.noData(List.of("-32767"), "dem.tif"));
        assertNull(GeoTiffReader.noData("nan", "dem.tif"));
        assertThrows(MalformedTableException.class, () -> GeoTiffReader.noData("none", "dem.tif"));
    }

    @Test
    void tiffWithoutGeoreferencingIsRejected() throws Exception {
        int width = 4;
        int height = 2;
        FieldType fieldType = FieldType.FLOAT;
        Rasters rasters = new Rasters(width, height, 1, fieldType);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rasters.setFirstPixelSample(x, y, (float) (y * width + x));
            }
        }
        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY));
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
        directory.setWriteRasters(rasters);
        TIFFImage written = new TIFFImage();
        written.add(directory);

        TIFFImage image = TiffReader.readTiff(TiffWriter.writeTiffToBytes(written));

        assertThrows(MalformedTableException.class, () -> reader.read(image, UTM31N, "plain.tif"));
    }
}
