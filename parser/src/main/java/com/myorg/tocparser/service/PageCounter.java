package com.myorg.tocparser.service;

import java.io.File;
import java.io.IOException;

public interface PageCounter {

    int countPages(File sourceFile) throws IOException;
}
