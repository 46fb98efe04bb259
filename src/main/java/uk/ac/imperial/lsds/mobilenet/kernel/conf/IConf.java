package uk.ac.imperial.lsds.mobilenet.kernel.conf;

public interface IConf {
}
