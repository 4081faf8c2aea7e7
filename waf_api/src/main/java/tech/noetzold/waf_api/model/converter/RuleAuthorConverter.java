package tech.noetzold.waf_api.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import tech.noetzold.waf_api.model.RuleAuthor;

@Converter
public class RuleAuthorConverter implements AttributeConverter<RuleAuthor, String> {

    @Override
    public String convertToDatabaseColumn(RuleAuthor attribute) {
        return attribute == null ? null : attribute.getWireName();
    }

    @Override
    public RuleAuthor convertToEntityAttribute(String dbData) {
        return RuleAuthor.fromWire(dbData);
    }
}
