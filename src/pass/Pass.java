package pass;


public interface Pass {
    // just a mark class for future change

    public interface IRPass extends Pass {
        IRPassType getType();
        void run();
    }
}
