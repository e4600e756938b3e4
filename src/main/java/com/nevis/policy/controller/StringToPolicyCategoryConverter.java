package com.nevis.policy.controller;

import com.nevis.policy.model.PolicyCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

@Component
public class StringToPolicyCategoryConverter implements Converter<String, PolicyCategory> {

    @Override
    public PolicyCategory convert(String source) {
        return PolicyCategory.fromValue(source);
    }
}
