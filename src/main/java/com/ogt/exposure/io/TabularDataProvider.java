package com.ogt.exposure.io;

import com.ogt.exposure.model.DataTable;

public interface TabularDataProvider {

    DataTable read(String source);
}
