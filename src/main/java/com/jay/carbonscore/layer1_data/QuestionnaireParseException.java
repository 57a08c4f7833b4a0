package com.jay.carbonscore.layer1_data;

/** Thrown when questionnaire JSON cannot be read into {@link com.jay.carbonscore.model.CompanyData}. */
public class QuestionnaireParseException extends RuntimeException {

    public QuestionnaireParseException(String message) {
        super(message);
    }

    public QuestionnaireParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
