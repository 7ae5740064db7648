package com.myorg.tocparser.service;

import com.myorg.tocparser.model.OutlineDocument;

import java.io.File;
import java.io.IOException;

public interface OutlineWriter {

    void write(File outputFile, OutlineDocument document) throws IOException;

    String writeAsString(OutlineDocument document) throws IOException;
}
