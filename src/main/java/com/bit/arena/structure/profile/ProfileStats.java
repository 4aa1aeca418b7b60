package com.bit.arena.structure.profile;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 后端签发的统计快照，整体覆盖写入档案
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ProfileStats {
    private long xp;
    private long level;
    private long progressCount;
    private long achievementCount;
}
