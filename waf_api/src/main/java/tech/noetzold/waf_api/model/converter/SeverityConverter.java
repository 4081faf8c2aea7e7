package tech.noetzold.waf_api.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import tech.noetzold.waf_api.model.Severity;

@Converter
public class SeverityConverter implements AttributeConverter<Severity, String> {

    @Override
    public String convertToDatabaseColumn(Severity attribute) {
        return attribute == null ? null : attribute.getWireName();
    }

    @Override
    public Severity convertToEntityAttribute(String dbData) {
        return dbData == null ? null : Severity.coerce(dbData);
    }
}
