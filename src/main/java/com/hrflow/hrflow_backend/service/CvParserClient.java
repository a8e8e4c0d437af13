package com.hrflow.hrflow_backend.service;

/** Text extraction for uploaded CVs. Never throws; problems come back as a failed result. */
public interface CvParserClient {

    CvParseResult parse(String fileId);
}
