package com.di.medallion.transform;

import com.di.medallion.dataset.Dataset;
import lombok.Value;

@Value
public class TransformResult {

    Dataset         conformed;
    TransformReport report;
}
