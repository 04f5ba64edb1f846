package com.community.leaderboard.entity;

import com.community.leaderboard.model.ActivityType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ActivityType} by its slug rather than its enum name.
 */
@Converter
public class ActivityTypeConverter implements AttributeConverter<ActivityType, String> {

    @Override
    public String convertToDatabaseColumn(ActivityType attribute) {
        return attribute == null ? null : attribute.getSlug();
    }

    @Override
    public ActivityType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ActivityType.fromSlug(dbData);
    }
}
