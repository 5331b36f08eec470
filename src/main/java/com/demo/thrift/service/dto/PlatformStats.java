package com.demo.thrift.service.dto;

import com.demo.thrift.model.GroupModel;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class PlatformStats {
    public long totalGroups;
    public long activeGroups;
    public long completedGroups;
    public long cancelledGroups;
    public long totalMembers;
    public long totalValueLocked;
    public Map<GroupModel, Long> groupsByModel = new EnumMap<>(GroupModel.class);
}
