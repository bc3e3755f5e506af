package com.dview.profiler.service.export;

import org.springframework.http.MediaType;

import lombok.Value;

@Value
public class ExportedFile {

  String fileName;
  MediaType mediaType;
  byte[] content;
}
