package com.ogt.exposure.io;

import com.ogt.exposure.model.Crs;
import com.ogt.exposure.model.RasterGrid;

public interface RasterProvider {

    /**
     * @param crs CRS of the grid when the source does not carry one
     */
    RasterGrid read(String source, Crs crs);
}
