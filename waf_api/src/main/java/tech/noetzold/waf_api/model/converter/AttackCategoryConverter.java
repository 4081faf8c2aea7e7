package tech.noetzold.waf_api.model.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import tech.noetzold.waf_api.model.AttackCategory;

@Converter
public class AttackCategoryConverter implements AttributeConverter<AttackCategory, String> {

    @Override
    public String convertToDatabaseColumn(AttackCategory attribute) {
        return attribute == null ? null : attribute.getWireName();
    }

    @Override
    public AttackCategory convertToEntityAttribute(String dbData) {
        return dbData == null ? null : AttackCategory.coerce(dbData);
    }
}
