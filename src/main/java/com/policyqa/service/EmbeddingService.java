package com.policyqa.service;

import java.util.List;

public interface EmbeddingService {

    float[] embedQuery(String query);

    List<float[]> embedAll(List<String> texts);
}
