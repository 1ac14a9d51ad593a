package com.loopguard.fixture;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ReportExporter {

    public byte[] export(Path report) throws IOException, InterruptedException {
        Thread.sleep(250);
        String body = Files.readString(report);
        try (InputStream in = new FileInputStream(report.toFile())) {
            return (body + in.read()).getBytes();
        }
    }

    public void abort(int code) {
        System.exit(code);
    }
}
